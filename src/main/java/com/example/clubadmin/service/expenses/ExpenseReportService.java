package com.example.clubadmin.service.expenses;

import com.example.clubadmin.domain.*;
import com.example.clubadmin.repository.ExpenseReportRepository;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.service.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.*;

/**
 * Member expense reports. Submitted reports are marked for accounting sync and announced
 * with an {@link ExpenseReportSubmittedEvent} once the transaction commits.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class ExpenseReportService {

    public static final String INACTIVE_USER = "You must be an active user to access this page.";
    public static final String RECEIPTS_REQUIRED = "All expense items must have a receipt attached before submission";
    public static final String CERTIFICATION_REQUIRED = "You must accept the certification to submit";
    public static final String BANK_ACCOUNT_REQUIRED =
            "requires a bank account. Please add a bank account in your user settings before submitting.";
    public static final String BANK_ACCOUNT_NOT_SELECTED = "must be selected. Please choose a bank account above.";
    public static final String ADDRESS_REQUIRED =
            "requires a billing address. Please add an address in your user settings before submitting.";
    public static final String SYNC_PENDING = "pending";
    public static final int MAX_PURPOSE = 1000;

    private final ExpenseReportRepository expenseReportRepository;
    private final BankAccountService bankAccountService;
    private final ApplicationEventPublisher events;

    public static void requireActive(User user) {
        if (user == null || !user.isActive()) {
            throw new AccessDeniedException(INACTIVE_USER);
        }
    }

    /* ───────── queries ───────── */

    @Transactional(readOnly = true)
    public List<ExpenseReport> list(User user) {
        requireActive(user);
        return expenseReportRepository.findByUserIdOrderByCreatedAtDesc(user.getId());
    }

    @Transactional(readOnly = true)
    public ExpenseReport get(Long id, User user) {
        requireActive(user);
        return expenseReportRepository.findByIdAndUserId(id, user.getId())
                .orElseThrow(() -> new NotFoundException("ExpenseReport", id));
    }

    public static ExpenseTotals totals(ExpenseReport report) {
        return new ExpenseTotals(report.expenseTotal(), report.incomeTotal(), report.netTotal());
    }

    /* ───────── create / submit ───────── */

    public ExpenseReport create(ExpenseReportDraft draft, User user) {
        requireActive(user);
        ExpenseReportStatus status = draft.effectiveStatus();
        Map<String, List<String>> errors = new LinkedHashMap<>();

        if (draft.purpose() == null || draft.purpose().isBlank()) {
            add(errors, "purpose", "can't be blank");
        } else if (draft.purpose().length() > MAX_PURPOSE) {
            add(errors, "purpose", "should be at most " + MAX_PURPOSE + " character(s)");
        }
        if (draft.reimbursementMethod() == null) {
            add(errors, "reimbursementMethod", "can't be blank");
        }
        validateItems(draft, errors);

        ExpenseReport report = ExpenseReport.builder()
                .user(user)
                .purpose(draft.purpose() == null ? null : draft.purpose().trim())
                .reimbursementMethod(draft.reimbursementMethod())
                .status(status)
                .certificationAccepted(draft.certificationAccepted())
                .build();
        draft.expenses().forEach(e -> report.addExpenseItem(ExpenseReportItem.builder()
                .date(e.date()).vendor(trim(e.vendor())).description(trim(e.description()))
                .amount(e.amount()).receiptPath(e.receiptPath()).build()));
        draft.incomes().forEach(i -> report.addIncomeItem(ExpenseReportIncomeItem.builder()
                .date(i.date()).description(trim(i.description()))
                .amount(i.amount()).proofPath(i.proofPath()).build()));

        applyReimbursementSetup(report, draft.bankAccountId(), user, errors);
        if (status == ExpenseReportStatus.SUBMITTED) {
            validateSubmission(report, errors);
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        ExpenseReport saved = expenseReportRepository.save(report);
        log.info("Created expense report {} for user {} with status {}", saved.getId(), user.getId(), status);
        if (status == ExpenseReportStatus.SUBMITTED) {
            markForSync(saved);
        }
        return saved;
    }

    /** Submits a draft. */
    public ExpenseReport submit(Long id, User user) {
        ExpenseReport report = get(id, user);
        if (report.getStatus() != ExpenseReportStatus.DRAFT) {
            throw new IllegalStateException("Only draft reports can be submitted");
        }
        Map<String, List<String>> errors = new LinkedHashMap<>();
        validateSubmission(report, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        report.setStatus(ExpenseReportStatus.SUBMITTED);
        log.info("Submitted expense report {} for user {}", id, user.getId());
        markForSync(report);
        return report;
    }

    public void delete(Long id, User user) {
        ExpenseReport report = get(id, user);
        expenseReportRepository.delete(report);
        log.info("Deleted expense report {} of user {}", id, user.getId());
    }

    private void markForSync(ExpenseReport report) {
        report.setQuickbooksSyncStatus(SYNC_PENDING);
        events.publishEvent(new ExpenseReportSubmittedEvent(report.getId(), report.getUser().getId()));
    }

    /* ───────── rules ───────── */

    private static void validateItems(ExpenseReportDraft draft, Map<String, List<String>> errors) {
        for (ExpenseReportDraft.Expense e : draft.expenses()) {
            if (e.date() == null) add(errors, "expenseItems", "date can't be blank");
            if (e.vendor() == null || e.vendor().isBlank()) add(errors, "expenseItems", "vendor can't be blank");
            if (e.amount() == null || e.amount().compareTo(BigDecimal.ZERO) <= 0) {
                add(errors, "expenseItems", "amount must be positive");
            }
        }
        for (ExpenseReportDraft.Income i : draft.incomes()) {
            if (i.date() == null) add(errors, "incomeItems", "date can't be blank");
            if (i.amount() == null || i.amount().compareTo(BigDecimal.ZERO) <= 0) {
                add(errors, "incomeItems", "amount must be positive");
            }
        }
    }

    /**
     * Bank transfer needs one of the member's own accounts. Check falls back to the
     * billing address.
     */
    private void applyReimbursementSetup(ExpenseReport report, Long bankAccountId, User user,
                                         Map<String, List<String>> errors) {
        if (report.getReimbursementMethod() == ReimbursementMethod.BANK_TRANSFER) {
            if (bankAccountId == null) {
                if (!bankAccountService.hasAny(user.getId())) {
                    add(errors, "reimbursementMethod", BANK_ACCOUNT_REQUIRED);
                } else {
                    add(errors, "bankAccountId", BANK_ACCOUNT_NOT_SELECTED);
                }
            } else {
                bankAccountService.findOwned(bankAccountId, user.getId()).ifPresentOrElse(
                        report::setBankAccount,
                        () -> add(errors, "bankAccountId", "is invalid"));
            }
        } else if (report.getReimbursementMethod() == ReimbursementMethod.CHECK) {
            Address billing = user.getBillingAddress();
            if (billing == null) {
                add(errors, "reimbursementMethod", ADDRESS_REQUIRED);
            } else {
                report.setAddress(billing);
            }
        }
    }

    private static void validateSubmission(ExpenseReport report, Map<String, List<String>> errors) {
        if (report.getExpenseItems().stream().anyMatch(i -> !i.hasReceipt())) {
            add(errors, "expenseItems", RECEIPTS_REQUIRED);
        }
        if (!report.isCertificationAccepted()) {
            add(errors, "certificationAccepted", CERTIFICATION_REQUIRED);
        }
    }

    private static void add(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }
}
