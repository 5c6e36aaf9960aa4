package com.example.clubadmin.web;

import com.example.clubadmin.domain.EntityType;
import com.example.clubadmin.service.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.view.InternalResourceViewResolver;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminMoneyControllerTest {

    private LedgerService ledger;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ledger = mock(LedgerService.class);
        when(ledger.accountsWithBalances(any())).thenReturn(List.of());
        when(ledger.recentPayments(any())).thenReturn(List.of());
        mvc = MockMvcBuilders.standaloneSetup(new AdminMoneyController(ledger))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setViewResolvers(new InternalResourceViewResolver("/WEB-INF/views/", ".html"))
                .build();
    }

    @Test
    void overviewFlagsAnInvalidDateRange() throws Exception {
        mvc.perform(get("/admin/money").param("start", "2024-13-01"))
                .andExpect(status().isOk())
                .andExpect(view().name("admin/money"))
                .andExpect(model().attribute("dateError", "Invalid date format"))
                .andExpect(model().attributeExists("refundForm", "creditForm", "balances", "payments"));
        verify(ledger).accountsWithBalances(null);
    }

    @Test
    void refundWithBadAmountReRendersWithFieldError() throws Exception {
        mvc.perform(post("/admin/money/refund")
                        .param("paymentId", "1")
                        .param("amount", "12.345")
                        .param("reason", "Cancelled"))
                .andExpect(status().isOk())
                .andExpect(view().name("admin/money"))
                .andExpect(model().attributeHasFieldErrors("refundForm", "amount"))
                .andExpect(model().attribute("errorMessage", AdminMoneyController.REFUND_FAILED));
        verify(ledger, never()).processRefund(any(), any(), any(), any());
    }

    @Test
    void refundMissingReasonIsAFieldError() throws Exception {
        mvc.perform(post("/admin/money/refund")
                        .param("paymentId", "1")
                        .param("amount", "5"))
                .andExpect(view().name("admin/money"))
                .andExpect(model().attributeHasFieldErrors("refundForm", "reason"));
    }

    @Test
    void validRefundRedirectsWithSuccess() throws Exception {
        mvc.perform(post("/admin/money/refund")
                        .param("paymentId", "1")
                        .param("amount", "$12.50")
                        .param("reason", " Cancelled night ")
                        .param("externalRefundId", "re_9"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/admin/money"))
                .andExpect(flash().attribute("successMessage", AdminMoneyController.REFUND_OK));
        verify(ledger).processRefund(1L, new BigDecimal("12.50"), "Cancelled night", "re_9");
    }

    @Test
    void rejectedRefundExplainsWhy() throws Exception {
        when(ledger.processRefund(eq(1L), any(), anyString(), isNull()))
                .thenThrow(new IllegalArgumentException("Refund of 90.00 exceeds refundable amount 50.00"));

        mvc.perform(post("/admin/money/refund")
                        .param("paymentId", "1")
                        .param("amount", "90")
                        .param("reason", "Too much"))
                .andExpect(redirectedUrl("/admin/money"))
                .andExpect(flash().attribute("errorMessage",
                        "Failed to process refund: Refund of 90.00 exceeds refundable amount 50.00"));
    }

    @Test
    void creditWithUnknownEntityTypeIsRejected() throws Exception {
        mvc.perform(post("/admin/money/credit")
                        .param("userId", "4")
                        .param("amount", "10")
                        .param("reason", "Goodwill")
                        .param("entityType", "spaceship"))
                .andExpect(view().name("admin/money"))
                .andExpect(model().attributeHasFieldErrors("creditForm", "entityType"))
                .andExpect(model().attribute("errorMessage", AdminMoneyController.CREDIT_FAILED));
    }

    @Test
    void creditDefaultsToAdministration() throws Exception {
        mvc.perform(post("/admin/money/credit")
                        .param("userId", "4")
                        .param("amount", "10")
                        .param("reason", "Goodwill"))
                .andExpect(redirectedUrl("/admin/money"))
                .andExpect(flash().attribute("successMessage", AdminMoneyController.CREDIT_OK));
        verify(ledger).addCredit(4L, new BigDecimal("10.00"), "Goodwill", EntityType.ADMINISTRATION, null);
    }
}
