package com.example.clubadmin.web;

import com.example.clubadmin.domain.ExpenseReport;
import com.example.clubadmin.domain.ExpenseReportIncomeItem;
import com.example.clubadmin.domain.ExpenseReportItem;
import com.example.clubadmin.domain.ReimbursementMethod;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.ValidationException;
import com.example.clubadmin.service.expenses.BankAccountService;
import com.example.clubadmin.service.expenses.ExpenseReportDraft;
import com.example.clubadmin.service.expenses.ExpenseReportService;
import com.example.clubadmin.service.expenses.ReceiptStorage;
import com.example.clubadmin.web.form.BankAccountForm;
import com.example.clubadmin.web.form.ExpenseReportForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Member-facing expense reports and the bank accounts used to reimburse them.
 * Inactive members get a 403 page from {@link ExpenseReportService#requireActive}.
 */
@Slf4j
@Controller
@RequestMapping("/expensereport")
@RequiredArgsConstructor
public class ExpenseReportController {

    private final ExpenseReportService expenseReportService;
    private final BankAccountService bankAccountService;
    private final ReceiptStorage receiptStorage;
    private final CurrentUserService currentUserService;

    @GetMapping
    public String list(Model model) {
        User user = currentUserService.currentUser();
        List<ExpenseReport> reports = expenseReportService.list(user);
        model.addAttribute("reports", reports);
        model.addAttribute("totals", reports.stream()
                .collect(Collectors.toMap(ExpenseReport::getId, ExpenseReportService::totals)));
        return "expensereport/list";
    }

    @GetMapping("/new")
    public String newReport(Model model) {
        User user = currentUserService.currentUser();
        ExpenseReportService.requireActive(user);
        if (!model.containsAttribute("reportForm")) {
            model.addAttribute("reportForm", new ExpenseReportForm());
        }
        populateForm(model, user);
        return "expensereport/form";
    }

    @PostMapping
    public String create(@Valid @ModelAttribute("reportForm") ExpenseReportForm form,
                         BindingResult binding,
                         Model model,
                         RedirectAttributes redirectAttributes) {
        User user = currentUserService.currentUser();
        ExpenseReportService.requireActive(user);
        ExpenseReportDraft draft = null;
        try {
            draft = form.toDraft(file -> receiptStorage.store(file).orElse(null));
        } catch (IllegalArgumentException e) {
            binding.rejectValue("expenseItems", "file", e.getMessage());
        }
        if (binding.hasErrors()) {
            populateForm(model, user);
            return "expensereport/form";
        }
        rememberStoredFiles(form, draft);
        try {
            ExpenseReport report = expenseReportService.create(draft, user);
            redirectAttributes.addFlashAttribute("successMessage",
                    form.isDraft() ? "Expense report saved as draft" : "Expense report submitted successfully");
            return "redirect:/expensereport/" + report.getId();
        } catch (ValidationException e) {
            copyErrors(e, binding);
            populateForm(model, user);
            return "expensereport/form";
        }
    }

    @GetMapping("/{id}")
    public String show(@PathVariable Long id, Model model) {
        ExpenseReport report = expenseReportService.get(id, currentUserService.currentUser());
        model.addAttribute("report", report);
        model.addAttribute("totals", ExpenseReportService.totals(report));
        return "expensereport/show";
    }

    @PostMapping("/{id}/submit")
    public String submit(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        try {
            expenseReportService.submit(id, currentUserService.currentUser());
            redirectAttributes.addFlashAttribute("successMessage", "Expense report submitted successfully");
        } catch (ValidationException e) {
            redirectAttributes.addFlashAttribute("errorMessage",
                    String.join(" ", e.getErrors().values().stream().flatMap(List::stream).toList()));
        } catch (IllegalStateException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/expensereport/" + id;
    }

    @PostMapping("/{id}/delete")
    public String delete(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        expenseReportService.delete(id, currentUserService.currentUser());
        redirectAttributes.addFlashAttribute("successMessage", "Expense report deleted");
        return "redirect:/expensereport";
    }

    /** Streams a receipt or proof attached to one of the member's own reports. */
    @GetMapping("/{id}/files")
    public ResponseEntity<Resource> file(@PathVariable Long id, @RequestParam String path) throws IOException {
        ExpenseReport report = expenseReportService.get(id, currentUserService.currentUser());
        boolean attached = Stream.concat(
                        report.getExpenseItems().stream().map(ExpenseReportItem::getReceiptPath),
                        report.getIncomeItems().stream().map(ExpenseReportIncomeItem::getProofPath))
                .anyMatch(path::equals);
        if (!attached) {
            return ResponseEntity.notFound().build();
        }
        MediaType type = MediaTypeFactory.getMediaType(path).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return receiptStorage.open(path)
                .<ResponseEntity<Resource>>map(in -> ResponseEntity.ok().contentType(type).body(new InputStreamResource(in)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /* ───────── bank accounts ───────── */

    @GetMapping("/bank-accounts")
    public String bankAccounts(Model model) {
        User user = currentUserService.currentUser();
        ExpenseReportService.requireActive(user);
        model.addAttribute("bankAccounts", bankAccountService.list(user.getId()));
        if (!model.containsAttribute("bankAccountForm")) {
            model.addAttribute("bankAccountForm", new BankAccountForm());
        }
        return "expensereport/bank-accounts";
    }

    @PostMapping("/bank-accounts")
    public String saveBankAccount(@ModelAttribute("bankAccountForm") BankAccountForm form,
                                  BindingResult binding,
                                  Model model,
                                  RedirectAttributes redirectAttributes) {
        User user = currentUserService.currentUser();
        ExpenseReportService.requireActive(user);
        try {
            bankAccountService.save(user, form.getRoutingNumber(), form.getAccountNumber());
            redirectAttributes.addFlashAttribute("successMessage", "Bank account saved");
            return "redirect:/expensereport/bank-accounts";
        } catch (ValidationException e) {
            copyErrors(e, binding);
            form.setAccountNumber(null);
            model.addAttribute("bankAccounts", bankAccountService.list(user.getId()));
            return "expensereport/bank-accounts";
        }
    }

    @PostMapping("/bank-accounts/{accountId}/delete")
    public String deleteBankAccount(@PathVariable Long accountId, RedirectAttributes redirectAttributes) {
        try {
            bankAccountService.delete(accountId, currentUserService.currentUser());
            redirectAttributes.addFlashAttribute("successMessage", "Bank account removed");
        } catch (IllegalStateException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/expensereport/bank-accounts";
    }

    /* ───────── helpers ───────── */

    private void populateForm(Model model, User user) {
        model.addAttribute("bankAccounts", bankAccountService.list(user.getId()));
        model.addAttribute("billingAddress", user.getBillingAddress());
        model.addAttribute("methods", ReimbursementMethod.values());
    }

    /** Keeps stored file keys on the form so a rejected submit does not lose uploads. */
    private static void rememberStoredFiles(ExpenseReportForm form, ExpenseReportDraft draft) {
        List<ExpenseReportForm.ExpenseItemForm> expenseRows = form.getExpenseItems().stream()
                .filter(r -> !r.isBlank()).toList();
        for (int i = 0; i < expenseRows.size() && i < draft.expenses().size(); i++) {
            expenseRows.get(i).setReceiptPath(draft.expenses().get(i).receiptPath());
        }
        List<ExpenseReportForm.IncomeItemForm> incomeRows = form.getIncomeItems().stream()
                .filter(r -> !r.isBlank()).toList();
        for (int i = 0; i < incomeRows.size() && i < draft.incomes().size(); i++) {
            incomeRows.get(i).setProofPath(draft.incomes().get(i).proofPath());
        }
    }

    /** Field messages go on the field when the form has it, otherwise become global errors. */
    static void copyErrors(ValidationException e, BindingResult binding) {
        e.getErrors().forEach((field, messages) -> messages.forEach(message -> {
            if (binding.getFieldType(field) != null) {
                binding.rejectValue(field, "invalid", message);
            } else {
                binding.reject("invalid", message);
            }
        }));
    }
}
