package io.intellixity.quill.examples.domain;

import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;

import java.util.List;

/** Catalog product stored in the top-level {@code products} collection. */
public record Product(String id, String name, String category, Integer priceCents, Boolean active, List<String> tags) {
  public static final Field<Product, String> NAME = Field.of("name", String.class);
  public static final Field<Product, String> CATEGORY = Field.of("category", String.class);
  public static final Field<Product, Integer> PRICE_CENTS = Field.of("priceCents", Integer.class);
  public static final Field<Product, Boolean> ACTIVE = Field.of("active", Boolean.class);
  public static final Field<Product, List<String>> TAGS = Field.list("tags", String.class);

  public static final RecordType<Product> TYPE = RecordType.builder(Product.class, "products")
      .idProperty("id")
      .fields(NAME, CATEGORY, PRICE_CENTS, ACTIVE, TAGS)
      .build();
}
