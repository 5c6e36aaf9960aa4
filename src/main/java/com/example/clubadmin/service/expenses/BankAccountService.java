package com.example.clubadmin.service.expenses;

import com.example.clubadmin.domain.BankAccount;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.BankAccountRepository;
import com.example.clubadmin.repository.ExpenseReportRepository;
import com.example.clubadmin.security.FieldCipher;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.service.ValidationException;
import com.example.clubadmin.util.RoutingNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Reimbursement bank accounts. One per member; saving again replaces the numbers.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class BankAccountService {

    public static final String UNAUTHORIZED = "Unauthorized";
    public static final String NOT_FOUND = "Bank account not found";
    public static final String IN_USE = "This bank account is used by an expense report and cannot be removed";

    private final BankAccountRepository bankAccountRepository;
    private final FieldCipher fieldCipher;
    private final ExpenseReportRepository expenseReportRepository;

    @Transactional(readOnly = true)
    public List<BankAccount> list(Long userId) {
        return bankAccountRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasAny(Long userId) {
        return bankAccountRepository.countByUserId(userId) > 0;
    }

    @Transactional(readOnly = true)
    public Optional<BankAccount> findOwned(Long id, Long userId) {
        return bankAccountRepository.findByIdAndUserId(id, userId);
    }

    public BankAccount save(User owner, String routingNumber, String accountNumber) {
        String routing = routingNumber == null ? null : routingNumber.trim();
        String account = accountNumber == null ? null : accountNumber.trim();
        Map<String, List<String>> errors = validate(routing, account);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        BankAccount bankAccount = bankAccountRepository.findByUserIdOrderByCreatedAtDesc(owner.getId()).stream()
                .findFirst()
                .orElseGet(() -> BankAccount.builder().user(owner).build());
        bankAccount.setRoutingNumberCiphertext(fieldCipher.encrypt(routing));
        bankAccount.setAccountNumberCiphertext(fieldCipher.encrypt(account));
        bankAccount.setAccountNumberLast4(account.substring(account.length() - 4));
        BankAccount saved = bankAccountRepository.save(bankAccount);
        log.info("Saved bank account {} for user {}", saved.getId(), owner.getId());
        return saved;
    }

    static Map<String, List<String>> validate(String routing, String account) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (routing == null || routing.isEmpty()) {
            add(errors, "routingNumber", "can't be blank");
        } else if (!RoutingNumbers.hasNineDigits(routing)) {
            add(errors, "routingNumber", "must be 9 digits");
        } else if (!RoutingNumbers.isValidChecksum(routing)) {
            add(errors, "routingNumber", "is not a valid US routing number");
        }

        if (account == null || account.isEmpty()) {
            add(errors, "accountNumber", "can't be blank");
        } else if (account.length() < 4) {
            add(errors, "accountNumber", "must be at least 4 digits");
        } else if (!account.chars().allMatch(c -> c >= '0' && c <= '9')) {
            add(errors, "accountNumber", "must contain only digits");
        }
        return errors;
    }

    private static void add(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }

    /**
     * @throws IllegalStateException {@value #IN_USE} while a report still points at the account
     */
    public void delete(Long id, User owner) {
        BankAccount account = bankAccountRepository.findByIdAndUserId(id, owner.getId())
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));
        if (expenseReportRepository.existsByBankAccountId(id)) {
            log.warn("Bank account {} of user {} is referenced by an expense report, not deleting", id, owner.getId());
            throw new IllegalStateException(IN_USE);
        }
        bankAccountRepository.delete(account);
        log.info("Deleted bank account {} of user {}", id, owner.getId());
    }

    /* ───────── treasurer ───────── */

    /**
     * Decrypts an account for an active treasurer.
     *
     * @throws AccessDeniedException for anyone else
     */
    @Transactional(readOnly = true)
    public BankAccountDetails unseal(Long bankAccountId, User viewer) {
        if (viewer == null || !viewer.isTreasurer()) {
            log.warn("User {} tried to unseal bank account {}", viewer == null ? null : viewer.getId(), bankAccountId);
            throw new AccessDeniedException(UNAUTHORIZED);
        }
        BankAccount account = bankAccountRepository.findById(bankAccountId)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));
        log.info("Treasurer {} unsealed bank account {}", viewer.getId(), bankAccountId);
        return new BankAccountDetails(account.getId(), account.getUser().getId(),
                fieldCipher.decrypt(account.getRoutingNumberCiphertext()),
                fieldCipher.decrypt(account.getAccountNumberCiphertext()),
                account.getAccountNumberLast4());
    }
}
