package com.ledgerlens.confirmation;

import com.ledgerlens.common.MoneyFormat;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.FinancialTransaction;
import com.ledgerlens.domain.TransactionType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Spanish chat texts for the confirmation round trip.
 */
@Component
public class ConfirmationMessageFormatter {

    static final String NOTHING_PENDING = "No hay transacciones pendientes de confirmación.";
    static final String REJECTED = "❌ Transacción cancelada como solicitaste. No se guardó en tu historial financiero.";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public String confirmationRequest(ClassificationResult result, double confidence) {
        StringBuilder sb = new StringBuilder();
        sb.append("📄 **He analizado tu documento financiero:**\n\n");
        sb.append(typeLabel(result.transactionType())).append('\n');
        sb.append("• **Categoría:** ").append(result.category());
        if (result.subcategory() != null && !result.subcategory().isBlank()) {
            sb.append(" (").append(result.subcategory()).append(')');
        }
        sb.append('\n');
        sb.append("• **Monto:** ").append(MoneyFormat.withCurrency(result.currency(), result.amount())).append('\n');
        sb.append("• **Comercio:** ").append(orDefault(result.merchant(), "No identificado")).append('\n');
        sb.append("• **Fecha:** ").append(date(result.transactionDate())).append('\n');
        sb.append("• **Descripción:** ").append(orDefault(result.description(), "")).append('\n');
        sb.append("• **Confianza:** ").append(Math.round(confidence * 100)).append("%\n\n");
        sb.append("¿Confirmas esta transacción para guardarla en tu historial financiero?\n\n");
        sb.append("**Responde \"si\" para confirmar o \"no\" para cancelar.**");
        return sb.toString();
    }

    public String saved(FinancialTransaction tx) {
        return "✅ Transacción guardada correctamente en tu historial financiero.\n\n📊 **Resumen:**\n"
                + "- Tipo: " + (tx.getTransactionType() == TransactionType.INCOME ? "Ingreso" : "Gasto") + '\n'
                + "- Categoría: " + tx.getCategory() + '\n'
                + "- Monto: " + MoneyFormat.withCurrency(tx.getCurrency(), tx.getAmount()) + '\n'
                + "- Comercio: " + orDefault(tx.getMerchant(), "No especificado") + '\n'
                + "- Fecha: " + date(tx.getTransactionDate());
    }

    public String rejected() {
        return REJECTED;
    }

    public String nothingPending() {
        return NOTHING_PENDING;
    }

    static String typeLabel(TransactionType type) {
        return type == TransactionType.INCOME ? "💰 Ingreso" : "💸 Gasto";
    }

    private static String date(LocalDate date) {
        return date == null ? "Sin fecha" : DATE.format(date);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
