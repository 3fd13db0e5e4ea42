package io.intellixity.quill.examples.service;

import io.intellixity.quill.examples.domain.Product;
import io.intellixity.quill.examples.domain.Review;
import io.intellixity.quill.exec.QueryBuilder;
import io.intellixity.quill.exec.QueryException;
import io.intellixity.quill.exec.Quill;
import io.intellixity.quill.query.Update;
import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public final class ProductService {
  private final Quill quill;

  public ProductService(Quill quill) {
    this.quill = quill;
  }

  /** Stores the product under its id, or a generated one when it has none. Returns the stored product. */
  public Product create(Product p) {
    DocumentRef ref = quill.query(Product.TYPE).set(p, p.id());
    return get(ref.id());
  }

  /** Null when there is no such product. */
  public Product get(String id) {
    try {
      return quill.query(Product.TYPE).getByDocumentId(id);
    } catch (QueryException e) {
      if (e.isNotFound()) return null;
      throw e;
    }
  }

  /** Active products, optionally narrowed by category and price ceiling, cheapest first. */
  public List<Product> search(String category, Integer maxPriceCents, Integer limit) {
    QueryBuilder<Product> q = quill.query(Product.TYPE).whereEqualTo(Product.ACTIVE, true);
    if (category != null) q = q.whereEqualTo(Product.CATEGORY, category);
    if (maxPriceCents != null) q = q.whereLessThanOrEqualTo(Product.PRICE_CENTS, maxPriceCents);
    q = q.orderBy(Product.PRICE_CENTS);
    if (limit != null) q = q.limit(limit);
    return q.all();
  }

  public List<Product> taggedWithAny(List<String> tags) {
    return quill.query(Product.TYPE).whereArrayContainsAny(Product.TAGS, tags).all();
  }

  public Optional<Product> mostExpensive(String category) {
    return quill.query(Product.TYPE)
        .whereEqualTo(Product.CATEGORY, category)
        .orderBy(Product.PRICE_CENTS, true)
        .first();
  }

  public long count(String category) {
    QueryBuilder<Product> q = quill.query(Product.TYPE);
    return (category == null) ? q.count() : q.whereEqualTo(Product.CATEGORY, category).count();
  }

  public void reprice(String id, int priceCents) {
    quill.query(Product.TYPE).update(Update.of(Product.TYPE).set(Product.PRICE_CENTS, priceCents), id);
  }

  public void deactivate(String id) {
    quill.query(Product.TYPE).update(Update.of(Product.TYPE).set(Product.ACTIVE, false), id);
  }

  public void delete(String id) {
    quill.query(Product.TYPE).delete(id);
  }

  public Review addReview(String productId, Review review) {
    QueryBuilder<Review> reviews = reviews(productId);
    DocumentRef ref = reviews.set(review, review.id());
    return reviews.getByDocumentId(ref.id());
  }

  public List<Review> reviews(String productId, int minRating) {
    return reviews(productId)
        .whereGreaterThanOrEqualTo(Review.RATING, minRating)
        .orderBy(Review.RATING, true)
        .all();
  }

  public List<Review> reviewsBy(String productId, String author) {
    return reviews(productId).whereEqualTo(Review.AUTHOR, author).all();
  }

  private QueryBuilder<Review> reviews(String productId) {
    return quill.query(Review.TYPE, CollectionPath.of(Product.TYPE.collectionName()).document(productId));
  }
}
