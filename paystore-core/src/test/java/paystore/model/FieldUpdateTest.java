package paystore.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class FieldUpdateTest {

  @Test
  void absent_isNotPresent() {
    FieldUpdate<String> update = FieldUpdate.absent();

    assertFalse(update.isPresent());
    assertThrows(NoSuchElementException.class, update::value);
  }

  @Test
  void ofNull_isPresentWithNullValue() {
    FieldUpdate<String> update = FieldUpdate.ofNull();

    assertTrue(update.isPresent());
    assertNull(update.value());
    assertEquals(FieldUpdate.of(null), update);
    assertNotEquals(FieldUpdate.absent(), update);
  }

  @Test
  void ifPresent_runsOnlyForPresentValues() {
    List<String> seen = new ArrayList<>();

    FieldUpdate.<String>absent().ifPresent(seen::add);
    FieldUpdate.of("x").ifPresent(seen::add);
    FieldUpdate.<String>ofNull().ifPresent(seen::add);

    assertEquals(2, seen.size());
    assertEquals("x", seen.get(0));
    assertNull(seen.get(1));
  }

  @Test
  void equality() {
    assertEquals(FieldUpdate.of(5L), FieldUpdate.of(5L));
    assertEquals(FieldUpdate.of(5L).hashCode(), FieldUpdate.of(5L).hashCode());
    assertNotEquals(FieldUpdate.of(5L), FieldUpdate.of(6L));
  }
}
