package io.b2mash.b2b.gobdvault.archive;

/** How the data key of a document was obtained from the configured root key. */
public enum KeyScheme {
  /** The root key itself. */
  ROOT,
  /** HKDF-SHA256 of the root key with the tenant ID as context. */
  TENANT_DERIVED
}
