package com.example.clubadmin.web;

import com.example.clubadmin.domain.EntityType;
import com.example.clubadmin.service.ledger.DateRange;
import com.example.clubadmin.service.ledger.LedgerService;
import com.example.clubadmin.util.MoneyParser;
import com.example.clubadmin.web.form.CreditForm;
import com.example.clubadmin.web.form.RefundForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.math.BigDecimal;

/**
 * Ledger overview, refunds and manual credits.
 */
@Slf4j
@Controller
@RequestMapping("/admin/money")
@RequiredArgsConstructor
public class AdminMoneyController {

    static final String REFUND_OK = "Refund processed successfully";
    static final String REFUND_FAILED = "Failed to process refund";
    static final String CREDIT_OK = "Credit added successfully";
    static final String CREDIT_FAILED = "Failed to add credit";

    private final LedgerService ledgerService;

    @GetMapping
    public String overview(@RequestParam(required = false) String start,
                           @RequestParam(required = false) String end,
                           Model model) {
        if (!model.containsAttribute("refundForm")) model.addAttribute("refundForm", new RefundForm());
        if (!model.containsAttribute("creditForm")) model.addAttribute("creditForm", new CreditForm());
        populate(model, start, end);
        return "admin/money";
    }

    @PostMapping("/refund")
    public String refund(@Valid @ModelAttribute("refundForm") RefundForm form,
                         BindingResult binding,
                         Model model,
                         RedirectAttributes redirectAttributes) {
        BigDecimal amount = parseAmount(form.getAmount(), binding);
        if (binding.hasErrors()) {
            return rerender(model, REFUND_FAILED);
        }
        try {
            ledgerService.processRefund(form.getPaymentId(), amount, form.getReason().trim(), form.getExternalRefundId());
            redirectAttributes.addFlashAttribute("successMessage", REFUND_OK);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Refund of payment {} rejected: {}", form.getPaymentId(), e.getMessage());
            redirectAttributes.addFlashAttribute("errorMessage", REFUND_FAILED + ": " + e.getMessage());
        } catch (Exception e) {
            log.error("Refund of payment {} failed", form.getPaymentId(), e);
            redirectAttributes.addFlashAttribute("errorMessage", REFUND_FAILED);
        }
        return "redirect:/admin/money";
    }

    @PostMapping("/credit")
    public String credit(@Valid @ModelAttribute("creditForm") CreditForm form,
                         BindingResult binding,
                         Model model,
                         RedirectAttributes redirectAttributes) {
        BigDecimal amount = parseAmount(form.getAmount(), binding);
        EntityType entityType = null;
        if (!binding.hasFieldErrors("entityType")) {
            try {
                entityType = EntityType.fromValue(form.getEntityType());
            } catch (IllegalArgumentException e) {
                binding.rejectValue("entityType", "invalid", "is invalid");
            }
        }
        if (binding.hasErrors()) {
            return rerender(model, CREDIT_FAILED);
        }
        try {
            String entityId = form.getEntityId() == null || form.getEntityId().isBlank() ? null : form.getEntityId().trim();
            ledgerService.addCredit(form.getUserId(), amount, form.getReason().trim(), entityType, entityId);
            redirectAttributes.addFlashAttribute("successMessage", CREDIT_OK);
        } catch (Exception e) {
            log.error("Credit for user {} failed", form.getUserId(), e);
            redirectAttributes.addFlashAttribute("errorMessage", CREDIT_FAILED);
        }
        return "redirect:/admin/money";
    }

    /** Adds "invalid amount format" / "must be positive" to {@code amount}. */
    private static BigDecimal parseAmount(String raw, BindingResult binding) {
        if (binding.hasFieldErrors("amount")) {
            return null;
        }
        try {
            return MoneyParser.parsePositive(raw);
        } catch (IllegalArgumentException e) {
            binding.rejectValue("amount", "invalid", e.getMessage());
            return null;
        }
    }

    private String rerender(Model model, String message) {
        if (!model.containsAttribute("refundForm")) model.addAttribute("refundForm", new RefundForm());
        if (!model.containsAttribute("creditForm")) model.addAttribute("creditForm", new CreditForm());
        model.addAttribute("errorMessage", message);
        populate(model, null, null);
        return "admin/money";
    }

    private void populate(Model model, String start, String end) {
        DateRange range = null;
        try {
            range = DateRange.parse(start, end);
        } catch (IllegalArgumentException e) {
            model.addAttribute("dateError", e.getMessage());
        }
        model.addAttribute("start", start);
        model.addAttribute("end", end);
        model.addAttribute("balances", ledgerService.accountsWithBalances(range));
        model.addAttribute("payments", ledgerService.recentPayments(range));
        model.addAttribute("entityTypes", EntityType.values());
    }
}
