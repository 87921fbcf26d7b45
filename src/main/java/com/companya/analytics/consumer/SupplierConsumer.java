package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import com.companya.analytics.model.payload.SupplierPayload;
import com.companya.analytics.model.row.SupplierRow;
import com.companya.analytics.repository.SupplierRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Slf4j
@Component
public class SupplierConsumer extends AbstractDomainConsumer {

    private final SupplierRepository supplierRepository;

    public SupplierConsumer(SupplierRepository supplierRepository, TransactionTemplate transactionTemplate,
                            ReplicaProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(transactionTemplate, properties, objectMapper, clock);
        this.supplierRepository = supplierRepository;
    }

    @Override
    public Topic topic() {
        return Topic.SUPPLIER;
    }

    @Override
    public EventHandler handlerFor(EventKind kind) {
        return switch (kind) {
            case SUPPLIER_CREATED, SUPPLIER_UPDATED -> this::upsertSupplier;
            case SUPPLIER_DELETED -> this::deleteSupplier;
            default -> null;
        };
    }

    void upsertSupplier(DomainEvent event) {
        SupplierPayload supplier = event.payload(SupplierPayload.class);
        SupplierPayload.ContactInfo contact = supplier.getContactInfo();
        SupplierPayload.CompanyInfo company = supplier.getCompanyInfo();
        SupplierPayload.Address address = company.getBusinessAddress();
        SupplierPayload.BusinessInfo business = supplier.getBusinessInfo();
        SupplierPayload.SocialMedia social = business.getSocialMedia();
        String supplierId = entityId(event);

        supplierRepository.upsert(SupplierRow.builder()
                .supplierId(supplierId)
                .email(require(contact.getPrimaryEmail(), "contact_info.primary_email", event))
                .primaryPhone(contact.getPrimaryPhone())
                .contactPersonName(contact.getContactPersonName())
                .contactPersonTitle(contact.getContactPersonTitle())
                .contactPersonEmail(contact.getContactPersonEmail())
                .contactPersonPhone(contact.getContactPersonPhone())
                .legalName(require(company.getLegalName(), "company_info.legal_name", event))
                .dbaName(company.getDbaName())
                .streetAddress1(address.getStreetAddress1())
                .streetAddress2(address.getStreetAddress2())
                .city(address.getCity())
                .state(address.getState())
                .zipCode(address.getZipCode())
                .country(address.getCountry())
                .supportEmail(business.getSupportEmail())
                .supportPhone(business.getSupportPhone())
                .facebookUrl(social.getFacebookUrl())
                .instagramHandle(social.getInstagramHandle())
                .twitterHandle(social.getTwitterHandle())
                .linkedinUrl(social.getLinkedinUrl())
                .timezone(business.getTimezone())
                .createdAt(timestampOrEventTime(supplier.getCreatedAt(), event))
                .updatedAt(timestampOrEventTime(supplier.getUpdatedAt(), event))
                .eventId(event.eventId())
                .eventTimestamp(eventTime(event))
                .build());
        log.info("[{}] supplier={}", event.kind(), supplierId);
    }

    void deleteSupplier(DomainEvent event) {
        String supplierId = deletedId(event);
        supplierRepository.delete(supplierId);
        log.info("[{}] supplier={}", event.kind(), supplierId);
    }
}
