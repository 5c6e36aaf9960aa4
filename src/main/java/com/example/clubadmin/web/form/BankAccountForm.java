package com.example.clubadmin.web.form;

import lombok.Getter;
import lombok.Setter;

/**
 * Digits are checked by {@code BankAccountService}; the form carries raw input only.
 */
@Getter
@Setter
public class BankAccountForm {

    private String routingNumber;

    private String accountNumber;

    @Override
    public String toString() {
        return "BankAccountForm[redacted]";
    }
}
