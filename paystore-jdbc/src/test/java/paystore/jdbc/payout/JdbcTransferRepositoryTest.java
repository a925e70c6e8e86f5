package paystore.jdbc.payout;

import paystore.db.Database;
import paystore.db.DatabaseId;
import paystore.jdbc.H2Databases;
import paystore.payout.TransferRepository;
import paystore.payout.model.Transfer;
import paystore.payout.model.TransferCreate;
import paystore.payout.model.TransferMethodType;
import paystore.payout.model.TransferUpdate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTransferRepositoryTest {
  private Database database;
  private TransferRepository repository;

  @BeforeEach
  void setUp() {
    database = H2Databases.connected(DatabaseId.PAYOUT_MAINDB);
    repository = new JdbcTransferRepository(database);
  }

  @AfterEach
  void tearDown() {
    database.disconnect();
  }

  private Transfer create(TransferMethodType method, long amount) {
    return repository.createTransfer(TransferCreate.builder()
        .subtotal(amount)
        .adjustments(0)
        .amount(amount)
        .method(method)
        .currency("usd")
        .status("new")
        .paymentAccountId(12L)
        .shouldRetryOnFailure(true)
        .build());
  }

  @Test
  void create_assignsIdAndCreatedAt() {
    Instant before = Instant.now().minusSeconds(1);

    Transfer created = create(TransferMethodType.STRIPE, 1500);

    assertTrue(created.id() > 0);
    assertTrue(created.createdAt().isAfter(before));
    assertEquals("stripe", created.method());
    assertEquals(Boolean.TRUE, created.shouldRetryOnFailure());
    assertNull(created.submittedAt());
    assertEquals(Optional.of(created), repository.getTransferById(created.id()));
  }

  @Test
  void getById_unknown_returnsEmpty() {
    assertEquals(Optional.empty(), repository.getTransferById(123_456L));
  }

  @Test
  void getByIds_returnsKnownOrderedById() {
    Transfer a = create(TransferMethodType.STRIPE, 100);
    Transfer b = create(TransferMethodType.STRIPE, 200);

    assertEquals(List.of(a, b), repository.getTransfersByIds(List.of(b.id(), 999_999L, a.id())));
    assertEquals(List.of(), repository.getTransfersByIds(List.of()));
  }

  @Test
  void idsSubmittedAfter_filtersByTimeAndMethod() {
    Instant start = Instant.parse("2024-01-10T00:00:00Z");
    Transfer early = create(TransferMethodType.STRIPE, 100);
    Transfer atStart = create(TransferMethodType.STRIPE, 200);
    Transfer late = create(TransferMethodType.STRIPE, 300);
    Transfer otherMethod = create(TransferMethodType.DOORDASH_PAY, 400);
    create(TransferMethodType.STRIPE, 500);
    submit(early, start.minusSeconds(1));
    submit(atStart, start);
    submit(late, start.plusSeconds(3600));
    submit(otherMethod, start.plusSeconds(60));

    assertEquals(List.of(atStart.id(), late.id()),
        repository.getTransferIdsSubmittedAfter(start, TransferMethodType.STRIPE));
    assertEquals(List.of(otherMethod.id()),
        repository.getTransferIdsSubmittedAfter(start, TransferMethodType.DOORDASH_PAY));
    assertEquals(List.of(),
        repository.getTransferIdsSubmittedAfter(start.plusSeconds(86_400), TransferMethodType.STRIPE));
  }

  @Test
  void update_changesOnlyPresentColumns() {
    Transfer created = create(TransferMethodType.STRIPE, 100);
    Instant submittedAt = Instant.parse("2024-02-01T10:00:00Z");

    Transfer updated = repository.updateTransferById(created.id(), TransferUpdate.builder()
        .status("paid")
        .submittedAt(submittedAt)
        .build()).orElseThrow();

    assertEquals("paid", updated.status());
    assertEquals(submittedAt, updated.submittedAt());
    assertEquals(created.amount(), updated.amount());
    assertEquals(created.createdAt(), updated.createdAt());
    assertEquals("stripe", updated.method());
  }

  @Test
  void update_unknownId_returnsEmpty() {
    assertEquals(Optional.empty(),
        repository.updateTransferById(999_999L, TransferUpdate.builder().status("paid").build()));
  }

  private void submit(Transfer transfer, Instant submittedAt) {
    repository.updateTransferById(transfer.id(), TransferUpdate.builder()
        .submittedAt(submittedAt)
        .status("submitted")
        .build()).orElseThrow();
  }
}
