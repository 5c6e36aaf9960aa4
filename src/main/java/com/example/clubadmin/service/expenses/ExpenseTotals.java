package com.example.clubadmin.service.expenses;

import java.math.BigDecimal;

public record ExpenseTotals(BigDecimal expenseTotal, BigDecimal incomeTotal, BigDecimal netTotal) {
}
