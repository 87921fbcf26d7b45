package com.companya.analytics.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * DDL for the replica, in execution order: parents before children, then indexes.
 * Column types stay within what both MySQL and H2 (MySQL mode) accept.
 */
public final class TableDefinitions {

    private TableDefinitions() {
    }

    public static final String USERS = """
            CREATE TABLE IF NOT EXISTS users (
                user_id         VARCHAR(255) NOT NULL,
                email           VARCHAR(255) NOT NULL,
                phone           VARCHAR(50),
                display_name    VARCHAR(255) NOT NULL,
                avatar          VARCHAR(500),
                bio             TEXT,
                version         INT,
                deleted_at      DATETIME(6),
                created_at      DATETIME(6) NOT NULL,
                updated_at      DATETIME(6) NOT NULL,
                event_id        VARCHAR(255),
                event_timestamp DATETIME(6),
                CONSTRAINT pk_users PRIMARY KEY (user_id)
            )""";

    public static final String SUPPLIERS = """
            CREATE TABLE IF NOT EXISTS suppliers (
                supplier_id          VARCHAR(255) NOT NULL,
                email                VARCHAR(255) NOT NULL,
                primary_phone        VARCHAR(50),
                contact_person_name  VARCHAR(255),
                contact_person_title VARCHAR(255),
                contact_person_email VARCHAR(255),
                contact_person_phone VARCHAR(50),
                legal_name           VARCHAR(255) NOT NULL,
                dba_name             VARCHAR(255),
                street_address_1     VARCHAR(255),
                street_address_2     VARCHAR(255),
                city                 VARCHAR(100),
                state                VARCHAR(100),
                zip_code             VARCHAR(20),
                country              VARCHAR(100),
                support_email        VARCHAR(255),
                support_phone        VARCHAR(50),
                facebook_url         VARCHAR(500),
                instagram_handle     VARCHAR(255),
                twitter_handle       VARCHAR(255),
                linkedin_url         VARCHAR(500),
                timezone             VARCHAR(50),
                created_at           DATETIME(6) NOT NULL,
                updated_at           DATETIME(6) NOT NULL,
                event_id             VARCHAR(255),
                event_timestamp      DATETIME(6),
                CONSTRAINT pk_suppliers PRIMARY KEY (supplier_id)
            )""";

    public static final String PRODUCTS = """
            CREATE TABLE IF NOT EXISTS products (
                product_id        VARCHAR(255) NOT NULL,
                supplier_id       VARCHAR(255) NOT NULL,
                supplier_name     VARCHAR(255),
                name              VARCHAR(255) NOT NULL,
                short_description TEXT,
                category          VARCHAR(100) NOT NULL,
                unit_type         VARCHAR(50),
                base_sku          VARCHAR(255),
                brand             VARCHAR(255),
                base_price_cents  INT,
                status            VARCHAR(50) NOT NULL,
                view_count        INT,
                favorite_count    INT,
                purchase_count    INT,
                total_reviews     INT,
                published_at      DATETIME(6),
                created_at        DATETIME(6) NOT NULL,
                updated_at        DATETIME(6) NOT NULL,
                event_id          VARCHAR(255),
                event_timestamp   DATETIME(6),
                CONSTRAINT pk_products PRIMARY KEY (product_id)
            )""";

    public static final String PRODUCT_VARIANTS = """
            CREATE TABLE IF NOT EXISTS product_variants (
                id              INT NOT NULL AUTO_INCREMENT,
                product_id      VARCHAR(255) NOT NULL,
                variant_key     VARCHAR(255) NOT NULL,
                variant_id      VARCHAR(255),
                variant_name    VARCHAR(255),
                attributes_json TEXT,
                price_cents     INT,
                cost_cents      INT,
                quantity        INT,
                width_cm        DOUBLE,
                height_cm       DOUBLE,
                depth_cm        DOUBLE,
                image_url       VARCHAR(500),
                CONSTRAINT pk_product_variants PRIMARY KEY (id),
                CONSTRAINT uq_product_variant UNIQUE (product_id, variant_key),
                CONSTRAINT fk_product_variants_product FOREIGN KEY (product_id)
                    REFERENCES products (product_id) ON DELETE CASCADE
            )""";

    public static final String ORDERS = """
            CREATE TABLE IF NOT EXISTS orders (
                order_id                VARCHAR(255) NOT NULL,
                order_number            VARCHAR(100) NOT NULL,
                customer_user_id        VARCHAR(255) NOT NULL,
                customer_display_name   VARCHAR(255),
                customer_email          VARCHAR(255),
                customer_phone          VARCHAR(50),
                shipping_recipient_name VARCHAR(255),
                shipping_phone          VARCHAR(50),
                shipping_street_1       VARCHAR(255),
                shipping_street_2       VARCHAR(255),
                shipping_city           VARCHAR(100),
                shipping_state          VARCHAR(100),
                shipping_zip_code       VARCHAR(20),
                shipping_country        VARCHAR(100),
                status                  VARCHAR(50) NOT NULL,
                created_at              DATETIME(6) NOT NULL,
                updated_at              DATETIME(6) NOT NULL,
                event_id                VARCHAR(255),
                event_timestamp         DATETIME(6),
                CONSTRAINT pk_orders PRIMARY KEY (order_id),
                CONSTRAINT uq_order_number UNIQUE (order_number)
            )""";

    public static final String ORDER_ITEMS = """
            CREATE TABLE IF NOT EXISTS order_items (
                id                      INT NOT NULL AUTO_INCREMENT,
                order_id                VARCHAR(255) NOT NULL,
                item_id                 VARCHAR(255) NOT NULL,
                product_id              VARCHAR(255) NOT NULL,
                supplier_id             VARCHAR(255) NOT NULL,
                product_name            VARCHAR(255) NOT NULL,
                variant_name            VARCHAR(255),
                variant_attributes_json TEXT,
                image_url               VARCHAR(500),
                supplier_name           VARCHAR(255),
                quantity                INT NOT NULL,
                unit_price_cents        INT NOT NULL,
                final_price_cents       INT NOT NULL,
                total_cents             INT NOT NULL,
                fulfillment_status      VARCHAR(50) NOT NULL,
                shipped_quantity        INT,
                tracking_number         VARCHAR(255),
                carrier                 VARCHAR(100),
                shipped_at              DATETIME(6),
                delivered_at            DATETIME(6),
                event_id                VARCHAR(255),
                event_timestamp         DATETIME(6),
                CONSTRAINT pk_order_items PRIMARY KEY (id),
                CONSTRAINT uq_order_item UNIQUE (order_id, item_id),
                CONSTRAINT fk_order_items_order FOREIGN KEY (order_id)
                    REFERENCES orders (order_id) ON DELETE CASCADE
            )""";

    public static final String POSTS = """
            CREATE TABLE IF NOT EXISTS posts (
                post_id             VARCHAR(255) NOT NULL,
                post_type           VARCHAR(50) NOT NULL,
                author_user_id      VARCHAR(255) NOT NULL,
                author_display_name VARCHAR(255),
                author_avatar       VARCHAR(500),
                author_type         VARCHAR(50),
                text_content        TEXT,
                media_json          TEXT,
                link_url            VARCHAR(500),
                link_title          VARCHAR(255),
                link_description    TEXT,
                link_image          VARCHAR(500),
                link_site_name      VARCHAR(255),
                view_count          INT,
                like_count          INT,
                comment_count       INT,
                share_count         INT,
                save_count          INT,
                engagement_rate     DOUBLE,
                last_comment_at     DATETIME(6),
                deleted_at          DATETIME(6),
                published_at        DATETIME(6),
                created_at          DATETIME(6) NOT NULL,
                updated_at          DATETIME(6) NOT NULL,
                event_id            VARCHAR(255),
                event_timestamp     DATETIME(6),
                CONSTRAINT pk_posts PRIMARY KEY (post_id)
            )""";

    public static final List<String> TABLES = List.of(
            USERS, SUPPLIERS, PRODUCTS, PRODUCT_VARIANTS, ORDERS, ORDER_ITEMS, POSTS);

    public static final List<String> INDEXES = List.of(
            "CREATE INDEX idx_users_email ON users (email)",
            "CREATE INDEX idx_users_created_at ON users (created_at)",
            "CREATE INDEX idx_suppliers_email ON suppliers (email)",
            "CREATE INDEX idx_suppliers_legal_name ON suppliers (legal_name)",
            "CREATE INDEX idx_suppliers_country ON suppliers (country, state, city)",
            "CREATE INDEX idx_products_supplier_id ON products (supplier_id)",
            "CREATE INDEX idx_products_category ON products (category)",
            "CREATE INDEX idx_products_status ON products (status)",
            "CREATE INDEX idx_products_created_at ON products (created_at)",
            "CREATE INDEX idx_product_variants_product_id ON product_variants (product_id)",
            "CREATE INDEX idx_orders_customer_user_id ON orders (customer_user_id)",
            "CREATE INDEX idx_orders_status ON orders (status)",
            "CREATE INDEX idx_orders_created_at ON orders (created_at)",
            "CREATE INDEX idx_order_items_order_id ON order_items (order_id)",
            "CREATE INDEX idx_order_items_product_id ON order_items (product_id)",
            "CREATE INDEX idx_posts_author_user_id ON posts (author_user_id)",
            "CREATE INDEX idx_posts_post_type ON posts (post_type)",
            "CREATE INDEX idx_posts_published_at ON posts (published_at)",
            "CREATE INDEX idx_posts_created_at ON posts (created_at)");

    public static final List<String> ALL = concat(TABLES, INDEXES);

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
