package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.web.ActorHeaders;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class SaleControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    private static MockHttpServletRequestBuilder as(Actor actor, MockHttpServletRequestBuilder request) {
        return request
                .header(ActorHeaders.ACTOR_ID, actor.getId().toString())
                .header(ActorHeaders.ACTOR_ROLE, actor.getRole().name().toLowerCase());
    }

    private static String saleBody(UUID productId, int quantity) {
        return """
                {"product_id": "%s", "quantity": %d, "unit_price": 150.00, "payment_method": "cash"}
                """.formatted(productId, quantity);
    }

    @Test
    @DisplayName("POST records a sale and returns 201 with snake_case fields")
    void recordSale() throws Exception {
        Product product = createProduct("HTTP-1", 10, "100", "150");

        mockMvc.perform(as(salesClerk, post("/api/sales"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 3)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.total_price").value(450.0))
                .andExpect(jsonPath("$.payment_status").value("PAID"))
                .andExpect(jsonPath("$.product_sku").value("HTTP-1"))
                .andExpect(jsonPath("$.sold_by").value(salesClerk.getId().toString()));

        assertEquals(7, stockOf(product.getId()));
    }

    @Test
    @DisplayName("Repeating the Idempotency-Key sells once")
    void idempotentPost() throws Exception {
        Product product = createProduct("HTTP-2", 10, "100", "150");

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(as(salesClerk, post("/api/sales"))
                            .header(ActorHeaders.IDEMPOTENCY_KEY, "till-7-receipt-42")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(saleBody(product.getId(), 2)))
                    .andExpect(status().isCreated());
        }

        assertEquals(8, stockOf(product.getId()));
    }

    @Test
    @DisplayName("Overselling is 409 with available and requested")
    void insufficientStock() throws Exception {
        Product product = createProduct("HTTP-3", 2, "100", "150");

        mockMvc.perform(as(salesClerk, post("/api/sales"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 5)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.available").value("2"))
                .andExpect(jsonPath("$.details.requested").value("5"));
    }

    @Test
    @DisplayName("Bean validation rejects a zero quantity with 400")
    void invalidBody() throws Exception {
        Product product = createProduct("HTTP-4", 2, "100", "150");

        mockMvc.perform(as(salesClerk, post("/api/sales"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 0)))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Missing actor headers are 400 and a wrong role is 403")
    void actorRequired() throws Exception {
        Product product = createProduct("HTTP-5", 2, "100", "150");

        mockMvc.perform(post("/api/sales")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 1)))
                .andExpect(status().isBadRequest());

        mockMvc.perform(as(stockKeeper, post("/api/sales"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 1)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Payment status patch, listing and delete round the sale lifecycle")
    void lifecycle() throws Exception {
        Product product = createProduct("HTTP-6", 10, "100", "150");
        String body = mockMvc.perform(as(salesClerk, post("/api/sales"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleBody(product.getId(), 1)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String saleId = JsonPath.read(body, "$.id");

        mockMvc.perform(as(salesClerk, patch("/api/sales/" + saleId + "/payment-status"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment_status\": \"pending\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment_status").value("PENDING"));

        mockMvc.perform(as(admin, get("/api/sales")).param("payment_status", "PENDING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_items").value(1))
                .andExpect(jsonPath("$.items[0].id").value(saleId));

        mockMvc.perform(as(salesClerk, delete("/api/sales/" + saleId)))
                .andExpect(status().isNoContent());

        mockMvc.perform(as(admin, get("/api/sales/" + saleId)))
                .andExpect(status().isNotFound());
        assertEquals(10, stockOf(product.getId()));
    }

    @Test
    @DisplayName("Reports are readable by every role; an unknown grouping is 400")
    void reportsEndpoint() throws Exception {
        createProduct("HTTP-7", 3, "100", "150");

        mockMvc.perform(as(stockKeeper, get("/api/reports/stock")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.low_stock_count").value(1));

        mockMvc.perform(as(salesClerk, get("/api/reports/sales/table")).param("group_by", "week"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[0]").value("Period"));

        mockMvc.perform(as(salesClerk, get("/api/reports/sales")).param("group_by", "year"))
                .andExpect(status().isBadRequest());
    }
}
