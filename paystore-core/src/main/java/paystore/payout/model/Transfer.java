package paystore.payout.model;

import java.time.Instant;

/**
 * A persisted {@code transfers} row. {@code method} stays a string because legacy rows hold
 * values outside {@link TransferMethodType}.
 */
public record Transfer(
    long id,
    long subtotal,
    long adjustments,
    long amount,
    String method,
    String currency,
    String status,
    String statusCode,
    Long paymentAccountId,
    Long recipientId,
    String statementDescription,
    String manualTransferReason,
    Boolean shouldRetryOnFailure,
    Instant submittingAt,
    Instant submittedAt,
    Instant createdAt,
    Instant deletedAt
) {
}
