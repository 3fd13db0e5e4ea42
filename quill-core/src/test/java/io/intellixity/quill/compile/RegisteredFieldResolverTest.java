package io.intellixity.quill.compile;

import io.intellixity.quill.fixtures.Item;
import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class RegisteredFieldResolverTest {
  private final FieldResolver resolver = FieldResolver.registered();

  record Product(String id, String title, Integer stock, Address address) {}
  record Address(String city) {}

  static final Field<Product, String> TITLE = Field.of("title", String.class);
  static final Field<Product, Integer> STOCK = Field.of("stock", Integer.class);
  static final Field<Product, String> CITY = Field.of("address.city", String.class);

  @Test
  void registeredField_resolvesToStructuralPath() {
    assertEquals(Optional.of("price"), resolver.resolve(Item.TYPE, Item.PRICE));
    assertEquals(Optional.of("tags"), resolver.resolve(Item.TYPE, Item.TAGS));
  }

  @Test
  void nestedPath_isKeptAsDotPath() {
    RecordType<Product> type = RecordType.builder(Product.class, "products").fields(TITLE, CITY).build();
    assertEquals(Optional.of("address.city"), resolver.resolve(type, CITY));
  }

  @Test
  void unregisteredField_isUnresolvable() {
    assertEquals(Optional.empty(), resolver.resolve(Item.TYPE, Item.COLOR));
  }

  @Test
  void storedNameTable_overridesPath() {
    RecordType<Product> type = RecordType.builder(Product.class, "products")
        .fields(TITLE, STOCK)
        .storedName(STOCK, "stock_count")
        .build();

    assertEquals(Optional.of("stock_count"), resolver.resolve(type, STOCK));
    assertEquals(Optional.of("title"), resolver.resolve(type, TITLE));
  }

  @Test
  void namingFunction_remapsSomeFields_restFallThrough() {
    RecordType<Product> type = RecordType.builder(Product.class, "products")
        .fields(TITLE, STOCK)
        .naming(f -> f == TITLE ? "product_title" : null)
        .build();

    assertEquals(Optional.of("product_title"), resolver.resolve(type, TITLE));
    assertEquals(Optional.of("stock"), resolver.resolve(type, STOCK));
  }

  @Test
  void namingFunction_canNameUnregisteredField() {
    RecordType<Product> type = RecordType.builder(Product.class, "products")
        .field(TITLE)
        .naming(f -> f == STOCK ? "qty" : null)
        .build();

    assertEquals(Optional.of("qty"), resolver.resolve(type, STOCK));
  }

  @Test
  void tableEntry_winsOverNamingFunction() {
    RecordType<Product> type = RecordType.builder(Product.class, "products")
        .storedName(TITLE, "from_table")
        .naming(f -> "from_function")
        .build();

    assertEquals(Optional.of("from_table"), resolver.resolve(type, TITLE));
  }

  @Test
  void blankNameFromFunction_fallsThrough() {
    RecordType<Product> type = RecordType.builder(Product.class, "products")
        .field(TITLE)
        .naming(f -> " ")
        .build();

    assertEquals(Optional.of("title"), resolver.resolve(type, TITLE));
  }
}
