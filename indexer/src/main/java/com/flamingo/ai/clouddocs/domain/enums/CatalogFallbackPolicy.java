package com.flamingo.ai.clouddocs.domain.enums;

/** Behaviour of catalog discovery when the remote catalog is unreachable. */
public enum CatalogFallbackPolicy {
  /** Serve the last persisted catalog, or the built-in one if nothing was persisted. */
  CACHED,

  /** Serve the small built-in catalog. */
  BUILT_IN,

  /** Fail the run. */
  FAIL
}
