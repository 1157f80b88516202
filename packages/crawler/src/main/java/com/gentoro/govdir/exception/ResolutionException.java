package com.gentoro.govdir.exception;

import java.util.Map;

/**
 * Entity resolution produced a graph that breaks an invariant, for example two different
 * identities hashing to the same identifier. Always fatal for graph finalization.
 */
public class ResolutionException extends GovDirException {
  public ResolutionException(String message, Map<String, ?> context) {
    super(GovDirErrorCode.RESOLUTION_ERROR, message, context);
  }
}
