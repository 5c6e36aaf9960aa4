package com.example.clubadmin.service.expenses;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.BankAccount;
import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.repository.BankAccountRepository;
import com.example.clubadmin.repository.ExpenseReportRepository;
import com.example.clubadmin.security.FieldCipher;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.service.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BankAccountServiceTest {

    private BankAccountRepository repository;
    private ExpenseReportRepository reports;
    private FieldCipher cipher;
    private BankAccountService service;
    private User owner;

    @BeforeEach
    void setUp() {
        repository = mock(BankAccountRepository.class);
        cipher = new FieldCipher(new ClubProperties());
        reports = mock(ExpenseReportRepository.class);
        service = new BankAccountService(repository, cipher, reports);
        owner = user(3L, UserState.ACTIVE, null);
        when(repository.save(any(BankAccount.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void numbersAreStoredEncryptedWithLastFour() {
        when(repository.findByUserIdOrderByCreatedAtDesc(3L)).thenReturn(List.of());

        BankAccount saved = service.save(owner, " 021000021 ", "000123456789");

        assertThat(saved.getUser()).isSameAs(owner);
        assertThat(saved.getAccountNumberLast4()).isEqualTo("6789");
        assertThat(saved.getAccountNumberCiphertext()).doesNotContain("123456789");
        assertThat(cipher.decrypt(saved.getRoutingNumberCiphertext())).isEqualTo("021000021");
        assertThat(cipher.decrypt(saved.getAccountNumberCiphertext())).isEqualTo("000123456789");
        assertThat(saved.masked()).isEqualTo("****6789");
    }

    @Test
    void savingAgainReplacesTheExistingAccount() {
        BankAccount existing = BankAccount.builder().id(8L).user(owner).accountNumberLast4("1111").build();
        when(repository.findByUserIdOrderByCreatedAtDesc(3L)).thenReturn(List.of(existing));

        BankAccount saved = service.save(owner, "011000015", "99998888");

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getAccountNumberLast4()).isEqualTo("8888");
    }

    @Test
    void invalidNumbersAreReportedPerField() {
        assertThatThrownBy(() -> service.save(owner, "011000016", "12a45"))
                .isInstanceOfSatisfying(ValidationException.class, ex -> {
                    assertThat(ex.errorsFor("routingNumber")).containsExactly("is not a valid US routing number");
                    assertThat(ex.errorsFor("accountNumber")).containsExactly("must contain only digits");
                });
        verify(repository, never()).save(any());
    }

    @Test
    void validationMessages() {
        assertThat(BankAccountService.validate("", "")).isEqualTo(Map.of(
                "routingNumber", List.of("can't be blank"),
                "accountNumber", List.of("can't be blank")));
        assertThat(BankAccountService.validate("12345", "123")).isEqualTo(Map.of(
                "routingNumber", List.of("must be 9 digits"),
                "accountNumber", List.of("must be at least 4 digits")));
        assertThat(BankAccountService.validate("021000021", "1234")).isEmpty();
    }

    @Test
    void onlyAnActiveTreasurerCanUnseal() {
        BankAccount account = BankAccount.builder().id(8L).user(owner)
                .routingNumberCiphertext(cipher.encrypt("021000021"))
                .accountNumberCiphertext(cipher.encrypt("000123456789"))
                .accountNumberLast4("6789").build();
        when(repository.findById(8L)).thenReturn(Optional.of(account));

        User treasurer = user(1L, UserState.ACTIVE, BoardPosition.TREASURER);
        BankAccountDetails details = service.unseal(8L, treasurer);
        assertThat(details.routingNumber()).isEqualTo("021000021");
        assertThat(details.accountNumber()).isEqualTo("000123456789");
        assertThat(details.toString()).doesNotContain("000123456789");

        User suspended = user(2L, UserState.SUSPENDED, BoardPosition.TREASURER);
        assertThatThrownBy(() -> service.unseal(8L, suspended))
                .isInstanceOf(AccessDeniedException.class).hasMessage(BankAccountService.UNAUTHORIZED);
        assertThatThrownBy(() -> service.unseal(8L, owner))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> service.unseal(99L, treasurer))
                .isInstanceOf(NotFoundException.class).hasMessage(BankAccountService.NOT_FOUND);
    }

    @Test
    void deleteOnlyTouchesOwnAccounts() {
        when(repository.findByIdAndUserId(8L, 3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(8L, owner)).isInstanceOf(NotFoundException.class);
        verify(repository, never()).delete(any());
    }

    @Test
    void accountUsedByAReportIsKept() {
        BankAccount account = BankAccount.builder().id(8L).user(owner).build();
        when(repository.findByIdAndUserId(8L, 3L)).thenReturn(Optional.of(account));
        when(reports.existsByBankAccountId(8L)).thenReturn(true);

        assertThatThrownBy(() -> service.delete(8L, owner))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(BankAccountService.IN_USE);
        verify(repository, never()).delete(any());
    }

    @Test
    void unusedAccountIsDeleted() {
        BankAccount account = BankAccount.builder().id(8L).user(owner).build();
        when(repository.findByIdAndUserId(8L, 3L)).thenReturn(Optional.of(account));

        service.delete(8L, owner);

        verify(repository).delete(account);
    }

    private static User user(Long id, UserState state, BoardPosition position) {
        User u = new User("u" + id + "@example.org", "first", "last");
        u.setId(id);
        u.setState(state);
        u.setBoardPosition(position);
        return u;
    }
}
