package com.example.clubadmin.web.form;

import com.example.clubadmin.domain.ExpenseReportStatus;
import com.example.clubadmin.domain.ReimbursementMethod;
import com.example.clubadmin.service.expenses.ExpenseReportDraft;
import com.example.clubadmin.util.MoneyParser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Expense report form with indexed item rows ({@code expenseItems[0].vendor}, ...).
 */
@Getter
@Setter
public class ExpenseReportForm {

    @NotBlank(message = "can't be blank")
    @Size(max = 1000, message = "should be at most 1000 character(s)")
    private String purpose;

    @NotNull(message = "can't be blank")
    private ReimbursementMethod reimbursementMethod = ReimbursementMethod.BANK_TRANSFER;

    private Long bankAccountId;

    private boolean certificationAccepted;

    /** Saves as a draft instead of submitting. */
    private boolean draft;

    @Valid
    private List<ExpenseItemForm> expenseItems = new ArrayList<>(List.of(new ExpenseItemForm()));

    @Valid
    private List<IncomeItemForm> incomeItems = new ArrayList<>();

    /**
     * Builds the draft, storing attached files with {@code storeFile} (returns the stored key).
     * Rows left completely empty are dropped.
     */
    public ExpenseReportDraft toDraft(Function<MultipartFile, String> storeFile) {
        List<ExpenseReportDraft.Expense> expenses = expenseItems.stream()
                .filter(i -> !i.isBlank())
                .map(i -> new ExpenseReportDraft.Expense(i.getDate(), i.getVendor(), i.getDescription(),
                        parseAmount(i.getAmount()), firstNonBlank(storeFile.apply(i.getReceipt()), i.getReceiptPath())))
                .toList();
        List<ExpenseReportDraft.Income> incomes = incomeItems.stream()
                .filter(i -> !i.isBlank())
                .map(i -> new ExpenseReportDraft.Income(i.getDate(), i.getDescription(),
                        parseAmount(i.getAmount()), firstNonBlank(storeFile.apply(i.getProof()), i.getProofPath())))
                .toList();
        return ExpenseReportDraft.builder()
                .purpose(purpose)
                .reimbursementMethod(reimbursementMethod)
                .status(draft ? ExpenseReportStatus.DRAFT : ExpenseReportStatus.SUBMITTED)
                .bankAccountId(bankAccountId)
                .certificationAccepted(certificationAccepted)
                .expenses(expenses)
                .incomes(incomes)
                .build();
    }

    private static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return MoneyParser.parse(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }

    @Getter
    @Setter
    public static class ExpenseItemForm {
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;
        @Size(max = 255, message = "should be at most 255 character(s)")
        private String vendor;
        @Size(max = 1000, message = "should be at most 1000 character(s)")
        private String description;
        private String amount;
        private MultipartFile receipt;
        /** Key of a receipt uploaded on an earlier, rejected submit. */
        private String receiptPath;

        public boolean isBlank() {
            return date == null && blank(vendor) && blank(description) && blank(amount)
                    && (receipt == null || receipt.isEmpty()) && blank(receiptPath);
        }
    }

    @Getter
    @Setter
    public static class IncomeItemForm {
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;
        @Size(max = 1000, message = "should be at most 1000 character(s)")
        private String description;
        private String amount;
        private MultipartFile proof;
        private String proofPath;

        public boolean isBlank() {
            return date == null && blank(description) && blank(amount)
                    && (proof == null || proof.isEmpty()) && blank(proofPath);
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
