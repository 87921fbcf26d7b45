package com.companya.analytics.kafka;

import com.companya.analytics.model.payload.OrderCancelledPayload;
import com.companya.analytics.model.payload.OrderPayload;
import com.companya.analytics.model.payload.PostDeletedPayload;
import com.companya.analytics.model.payload.PostPayload;
import com.companya.analytics.model.payload.ProductDeletedPayload;
import com.companya.analytics.model.payload.ProductPayload;
import com.companya.analytics.model.payload.SupplierDeletedPayload;
import com.companya.analytics.model.payload.SupplierPayload;
import com.companya.analytics.model.payload.UserDeletedPayload;
import com.companya.analytics.model.payload.UserPayload;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of event kinds. Each kind belongs to exactly one topic and
 * decodes its {@code data} block into exactly one payload type.
 */
public enum EventKind {
    USER_CREATED(Topic.USER, "created", UserPayload.class),
    USER_UPDATED(Topic.USER, "updated", UserPayload.class),
    USER_DELETED(Topic.USER, "deleted", UserDeletedPayload.class),

    SUPPLIER_CREATED(Topic.SUPPLIER, "created", SupplierPayload.class),
    SUPPLIER_UPDATED(Topic.SUPPLIER, "updated", SupplierPayload.class),
    SUPPLIER_DELETED(Topic.SUPPLIER, "deleted", SupplierDeletedPayload.class),

    PRODUCT_CREATED(Topic.PRODUCT, "created", ProductPayload.class),
    PRODUCT_UPDATED(Topic.PRODUCT, "updated", ProductPayload.class),
    PRODUCT_PUBLISHED(Topic.PRODUCT, "published", ProductPayload.class),
    PRODUCT_DISCONTINUED(Topic.PRODUCT, "discontinued", ProductPayload.class),
    PRODUCT_OUT_OF_STOCK(Topic.PRODUCT, "out_of_stock", ProductPayload.class),
    PRODUCT_RESTORED(Topic.PRODUCT, "restored", ProductPayload.class),
    PRODUCT_DELETED(Topic.PRODUCT, "deleted", ProductDeletedPayload.class),

    ORDER_CREATED(Topic.ORDER, "created", OrderPayload.class),
    ORDER_STATUS_CHANGED(Topic.ORDER, "status_changed", OrderPayload.class),
    ORDER_CANCELLED(Topic.ORDER, "cancelled", OrderCancelledPayload.class),

    POST_CREATED(Topic.POST, "created", PostPayload.class),
    POST_UPDATED(Topic.POST, "updated", PostPayload.class),
    POST_PUBLISHED(Topic.POST, "published", PostPayload.class),
    POST_DELETED(Topic.POST, "deleted", PostDeletedPayload.class);

    private final Topic topic;
    private final String action;
    private final Class<?> payloadType;

    EventKind(Topic topic, String action, Class<?> payloadType) {
        this.topic = topic;
        this.action = action;
        this.payloadType = payloadType;
    }

    public Topic getTopic() {
        return topic;
    }

    public String getAction() {
        return action;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    /**
     * @return the {@code event_type} string used on the wire, e.g. {@code product.out_of_stock}
     */
    public String wireName() {
        return topic.topicName() + "." + action;
    }

    public boolean belongsTo(String topicName) {
        return topic.topicName().equals(topicName);
    }

    public static Optional<EventKind> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (EventKind kind : values()) {
            if (kind.wireName().equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Set<EventKind> forTopic(Topic topic) {
        Set<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        for (EventKind kind : values()) {
            if (kind.topic == topic) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
