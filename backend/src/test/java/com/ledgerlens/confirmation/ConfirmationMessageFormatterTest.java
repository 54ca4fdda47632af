package com.ledgerlens.confirmation;

import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.FinancialTransaction;
import com.ledgerlens.domain.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ConfirmationMessageFormatterTest {

    private final ConfirmationMessageFormatter formatter = new ConfirmationMessageFormatter();

    @Test
    @DisplayName("the request summary shows type, subcategory, amount, date and rounded confidence")
    void confirmationRequest() {
        ClassificationResult result = new ClassificationResult(TransactionType.EXPENSE, "alimentacion",
                "supermercado", new BigDecimal("15990"), "CLP", LocalDate.of(2025, 5, 20), "Compra semanal",
                "JUMBO", 0.9, null, null, null);

        String text = formatter.confirmationRequest(result, 0.846);

        assertThat(text)
                .contains("💸 Gasto")
                .contains("alimentacion (supermercado)")
                .contains("CLP 15.990")
                .contains("JUMBO")
                .contains("20/05/2025")
                .contains("85%")
                .contains("\"si\"");
    }

    @Test
    @DisplayName("missing merchant and date fall back to placeholders")
    void placeholders() {
        ClassificationResult result = new ClassificationResult(TransactionType.INCOME, "sueldo", null,
                new BigDecimal("850000"), null, null, null, null, 0.7, null, null, null);

        String text = formatter.confirmationRequest(result, 0.7);

        assertThat(text)
                .contains("💰 Ingreso")
                .contains("No identificado")
                .contains("Sin fecha")
                .contains("CLP 850.000")
                .doesNotContain("(null)");
    }

    @Test
    @DisplayName("the saved summary describes the stored transaction")
    void saved() {
        FinancialTransaction tx = new FinancialTransaction();
        tx.setTransactionType(TransactionType.INCOME);
        tx.setCategory("sueldo");
        tx.setAmount(new BigDecimal("850000"));
        tx.setCurrency("CLP");
        tx.setTransactionDate(LocalDate.of(2025, 5, 30));

        assertThat(formatter.saved(tx))
                .contains("Tipo: Ingreso")
                .contains("Monto: CLP 850.000")
                .contains("Comercio: No especificado")
                .contains("Fecha: 30/05/2025");
    }
}
