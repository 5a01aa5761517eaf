package com.flagship.inventory_ledger;

import com.flagship.inventory_ledger.catalog.NewProduct;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.catalog.ProductService;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.user.AppUserEntity;
import com.flagship.inventory_ledger.user.AppUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Shared setup for tests that need the full application against Postgres.
 *
 * One container serves every test class so the cached Spring context keeps
 * pointing at a live database. Redis is mocked (the idempotency cache falls
 * back to the database) and the Kafka outbox publisher is switched off.
 */
@SpringBootTest
@Testcontainers
public abstract class IntegrationTestSupport {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("inventory_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!postgres.isRunning()) {
            postgres.start();
        }
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected ProductService productService;

    @Autowired
    protected AppUserRepository userRepository;

    protected Actor admin;
    protected Actor salesClerk;
    protected Actor stockKeeper;

    @BeforeEach
    void resetDatabase() {
        // stock_movements and audit_entries reject DELETE, TRUNCATE is the only way to clear them
        jdbcTemplate.execute("TRUNCATE TABLE notifications, audit_entries, outbox_events, stock_movements, " +
                "sales, purchases, expenses, products, app_users");

        admin = registerUser("admin", Role.ADMIN);
        salesClerk = registerUser("sales", Role.SALES);
        stockKeeper = registerUser("stock", Role.STOCK);
    }

    protected Actor registerUser(String name, Role role) {
        UUID id = UUID.randomUUID();
        userRepository.saveAndFlush(AppUserEntity.register(id, name + "-" + id + "@example.com",
                capitalize(name) + " User", role));
        return Actor.of(id, role);
    }

    protected Product createProduct(String sku, int openingStock, String costPrice, String sellingPrice) {
        return productService.create(NewProduct.builder()
                .name("Product " + sku)
                .sku(sku)
                .category("General")
                .costPrice(new BigDecimal(costPrice))
                .sellingPrice(new BigDecimal(sellingPrice))
                .openingStock(openingStock)
                .build(), admin);
    }

    protected int stockOf(UUID productId) {
        return productService.get(productId).getStockQuantity();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
