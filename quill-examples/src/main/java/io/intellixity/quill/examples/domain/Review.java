package io.intellixity.quill.examples.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;

/** Product review, stored under {@code products/{productId}/reviews}. */
public record Review(String id,
                     @JsonProperty("author_name") String author,
                     Integer rating,
                     String text) {
  public static final Field<Review, String> AUTHOR = Field.of("author", String.class);
  public static final Field<Review, Integer> RATING = Field.of("rating", Integer.class);

  public static final RecordType<Review> TYPE = RecordType.builder(Review.class, "reviews")
      .idProperty("id")
      .field(RATING)
      .storedName(AUTHOR, "author_name")
      .build();
}
