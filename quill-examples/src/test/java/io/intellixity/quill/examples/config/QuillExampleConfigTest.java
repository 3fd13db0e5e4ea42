package io.intellixity.quill.examples.config;

import io.intellixity.quill.compile.UnresolvedFieldPolicy;
import io.intellixity.quill.exec.Quill;
import io.intellixity.quill.spi.memory.InMemoryDocumentStore;
import io.intellixity.quill.store.DocumentStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QuillExampleConfigTest {
  private final QuillExampleConfig config = new QuillExampleConfig();

  @Test
  void defaults() {
    QuillProperties props = new QuillProperties();
    assertEquals("memory", props.getStore());
    assertEquals("quill", props.getMongo().getDatabase());
    assertFalse(props.isStrictFields());
  }

  @Test
  void strictFields_selectsFailPolicy() {
    QuillProperties props = new QuillProperties();
    DocumentStore store = config.inMemoryDocumentStore();
    assertInstanceOf(InMemoryDocumentStore.class, store);

    assertEquals(UnresolvedFieldPolicy.SKIP, config.quill(store, props).unresolvedFieldPolicy());

    props.setStrictFields(true);
    Quill strict = config.quill(store, props);
    assertEquals(UnresolvedFieldPolicy.FAIL, strict.unresolvedFieldPolicy());
    assertSame(store, strict.store());
  }
}
