package com.example.clubadmin.web;

import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.ValidationException;
import com.example.clubadmin.service.expenses.BankAccountService;
import com.example.clubadmin.service.expenses.ExpenseReportService;
import com.example.clubadmin.service.expenses.ReceiptStorage;
import com.example.clubadmin.web.form.ExpenseReportForm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.web.servlet.view.InternalResourceViewResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasProperty;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ExpenseReportControllerTest {

    private BankAccountService bankAccounts;
    private CurrentUserService current;
    private User member;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        bankAccounts = mock(BankAccountService.class);
        current = mock(CurrentUserService.class);
        member = User.builder().id(2L).email("member@example.org").state(UserState.ACTIVE).build();
        when(current.currentUser()).thenReturn(member);
        when(bankAccounts.list(2L)).thenReturn(List.of());
        ExpenseReportController controller = new ExpenseReportController(
                mock(ExpenseReportService.class), bankAccounts, mock(ReceiptStorage.class), current);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setViewResolvers(new InternalResourceViewResolver("/WEB-INF/views/", ".html"))
                .build();
    }

    @Test
    void inactiveMemberGetsForbiddenPage() throws Exception {
        member.setState(UserState.SUSPENDED);

        mvc.perform(get("/expensereport/new"))
                .andExpect(status().isForbidden())
                .andExpect(view().name("error/403"));
    }

    @Test
    void rejectedBankAccountReRendersWithoutAccountNumber() throws Exception {
        when(bankAccounts.save(any(), anyString(), anyString())).thenThrow(new ValidationException(
                Map.of("routingNumber", List.of("is not a valid routing number"))));

        mvc.perform(post("/expensereport/bank-accounts")
                        .param("routingNumber", "123456789")
                        .param("accountNumber", "000123456"))
                .andExpect(status().isOk())
                .andExpect(view().name("expensereport/bank-accounts"))
                .andExpect(model().attributeHasFieldErrors("bankAccountForm", "routingNumber"))
                .andExpect(model().attribute("bankAccountForm",
                        hasProperty("accountNumber", nullValue())));
    }

    @Test
    void savedBankAccountRedirects() throws Exception {
        mvc.perform(post("/expensereport/bank-accounts")
                        .param("routingNumber", "011000015")
                        .param("accountNumber", "000123456"))
                .andExpect(redirectedUrl("/expensereport/bank-accounts"))
                .andExpect(flash().attribute("successMessage", "Bank account saved"));
        verify(bankAccounts).save(member, "011000015", "000123456");
    }

    @Test
    void bankAccountStillInUseIsNotRemoved() throws Exception {
        doThrow(new IllegalStateException(BankAccountService.IN_USE)).when(bankAccounts).delete(8L, member);

        mvc.perform(post("/expensereport/bank-accounts/8/delete"))
                .andExpect(redirectedUrl("/expensereport/bank-accounts"))
                .andExpect(flash().attribute("errorMessage", BankAccountService.IN_USE))
                .andExpect(flash().attributeCount(1));
    }

    @Test
    void copyErrorsPlacesKnownFieldsAndKeepsTheRestGlobal() {
        ExpenseReportForm form = new ExpenseReportForm();
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(form, "reportForm");
        Map<String, List<String>> errors = new LinkedHashMap<>();
        errors.put("bankAccountId", List.of("can't be blank"));
        errors.put("expenseItems[0].amount", List.of("must be positive"));
        errors.put("base", List.of("Expense report must have at least one expense or income item"));

        ExpenseReportController.copyErrors(new ValidationException(errors), binding);

        assertThat(binding.getFieldError("bankAccountId").getDefaultMessage()).isEqualTo("can't be blank");
        assertThat(binding.getFieldError("expenseItems[0].amount").getDefaultMessage()).isEqualTo("must be positive");
        assertThat(binding.getGlobalErrors()).singleElement()
                .satisfies(e -> assertThat(e.getDefaultMessage())
                        .isEqualTo("Expense report must have at least one expense or income item"));
    }
}
