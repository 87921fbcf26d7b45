package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.helper.TestEvents;
import com.companya.analytics.model.row.SupplierRow;
import com.companya.analytics.repository.SupplierRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("SupplierConsumer")
class SupplierConsumerTest {

    @Mock
    private SupplierRepository supplierRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    private SupplierConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new SupplierConsumer(supplierRepository, transactionTemplate, new ReplicaProperties(),
                TestEvents.MAPPER, Clock.systemUTC());
    }

    @Test
    @DisplayName("Flattens contact, company address and social media")
    void flattensNestedObjects() {
        // When
        consumer.upsertSupplier(TestEvents.event("supplier-created"));

        // Then
        ArgumentCaptor<SupplierRow> captor = ArgumentCaptor.forClass(SupplierRow.class);
        verify(supplierRepository).upsert(captor.capture());
        SupplierRow row = captor.getValue();
        assertThat(row.getSupplierId()).isEqualTo("s1");
        assertThat(row.getEmail()).isEqualTo("sales@acme.example");
        assertThat(row.getContactPersonTitle()).isEqualTo("Head of Sales");
        assertThat(row.getLegalName()).isEqualTo("Acme Trading LLC");
        assertThat(row.getStreetAddress2()).isEqualTo("Suite 4");
        assertThat(row.getCity()).isEqualTo("Austin");
        assertThat(row.getCountry()).isEqualTo("US");
        assertThat(row.getInstagramHandle()).isEqualTo("@acme");
        assertThat(row.getLinkedinUrl()).isEqualTo("https://linkedin.com/company/acme");
        assertThat(row.getTimezone()).isEqualTo("America/Chicago");
        assertThat(row.getEventTimestamp()).isEqualTo(LocalDateTime.of(2024, 2, 10, 7, 0));
    }

    @Test
    @DisplayName("Missing nested objects degrade to null columns")
    void missingNestedObjectsAreNull() {
        consumer.upsertSupplier(TestEvents.decode("""
                {"event_type":"supplier.updated","entity_id":"s2","timestamp":"2024-02-11T00:00:00Z",
                 "data":{"contact_info":{"primary_email":"x@y.example"},
                         "company_info":{"legal_name":"X Corp","business_address":null},
                         "business_info":null}}"""));

        ArgumentCaptor<SupplierRow> captor = ArgumentCaptor.forClass(SupplierRow.class);
        verify(supplierRepository).upsert(captor.capture());
        assertThat(captor.getValue().getCity()).isNull();
        assertThat(captor.getValue().getFacebookUrl()).isNull();
    }

    @Test
    @DisplayName("A missing legal name violates the contract")
    void missingLegalNameFails() {
        DomainEvent event = TestEvents.decode("""
                {"event_type":"supplier.created","entity_id":"s3",
                 "data":{"contact_info":{"primary_email":"x@y.example"}}}""");

        assertThatThrownBy(() -> consumer.upsertSupplier(event)).isInstanceOf(PayloadContractException.class);
        verifyNoInteractions(supplierRepository);
    }

    @Test
    @DisplayName("supplier.deleted hard-deletes by id")
    void deletes() {
        consumer.deleteSupplier(TestEvents.decode(
                "{\"event_type\":\"supplier.deleted\",\"entity_id\":\"s1\",\"data\":{\"supplier_id\":\"s1\"}}"));

        verify(supplierRepository).delete("s1");
    }
}
