package com.example.clubadmin.service.expenses;

/**
 * Decrypted bank account numbers, only ever handed to a treasurer view.
 */
public record BankAccountDetails(Long id, Long userId, String routingNumber, String accountNumber, String accountNumberLast4) {

    @Override
    public String toString() {
        return "BankAccountDetails[id=" + id + ", userId=" + userId + ", last4=" + accountNumberLast4 + "]";
    }
}
