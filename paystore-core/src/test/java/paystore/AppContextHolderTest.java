package paystore;

import paystore.client.BackofficeClientSettings;
import paystore.db.DatabaseId;
import paystore.db.DatabaseUrls;
import paystore.db.StubConnectionPoolFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppContextHolderTest {

  private final AppContextHolder holder = new AppContextHolder();
  private AppContext context;
  private AppContext other;

  @BeforeEach
  void setUp() {
    context = newContext();
    other = newContext();
  }

  @AfterEach
  void tearDown() {
    context.close();
    other.close();
  }

  private static AppContext newContext() {
    AppConfig.Builder builder = AppConfig.builder()
        .backoffice(new BackofficeClientSettings("https://bo.example.com", "svc@example.com",
            Secret.of("pw"), Duration.ofMinutes(10)));
    for (DatabaseId id : DatabaseId.values()) {
      builder.database(id, DatabaseUrls.masterOnly("jdbc:stub:" + id.id()));
    }
    return AppContext.create(builder.build(), new StubConnectionPoolFactory());
  }

  @Test
  void attachThenGet() {
    assertFalse(holder.exists());

    holder.attach(context);

    assertTrue(holder.exists());
    assertSame(context, holder.get());
  }

  @Test
  void getBeforeAttach_throws() {
    assertThrows(IllegalStateException.class, holder::get);
  }

  @Test
  void attachTwice_throws() {
    holder.attach(context);

    assertThrows(IllegalStateException.class, () -> holder.attach(other));
    assertSame(context, holder.get());
  }

  @Test
  void detachAttached_clearsSlot() {
    holder.attach(context);

    holder.detach(context);

    assertFalse(holder.exists());
    holder.attach(other);
    assertSame(other, holder.get());
  }

  @Test
  void detachDifferentContext_throwsAndKeepsAttached() {
    holder.attach(context);

    assertThrows(IllegalStateException.class, () -> holder.detach(other));
    assertSame(context, holder.get());
  }

  @Test
  void detachWhenEmpty_throws() {
    assertThrows(IllegalStateException.class, () -> holder.detach(context));
  }
}
