package io.b2mash.b2b.gobdvault.retention;

/** PENDING_REVIEW → CONFIRMED → DELETED. No other transition exists. */
public enum DeletionReviewStatus {
  PENDING_REVIEW,
  CONFIRMED,
  DELETED
}
