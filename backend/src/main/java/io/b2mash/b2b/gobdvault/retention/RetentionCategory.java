package io.b2mash.b2b.gobdvault.retention;

/** Statutory retention classes. Years per class come from {@link RetentionProperties}. */
public enum RetentionCategory {
  /** Books, invoices, booking vouchers (§147 AO). */
  TAX_RELEVANT,
  BUSINESS,
  CORRESPONDENCE,
  HR,
  LEGAL,
  TEMPORARY
}
