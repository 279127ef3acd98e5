package com.errorchain.boundary;

import java.util.Optional;

/**
 * Decides the kind, message and location under which an error thrown by an external collaborator
 * enters the error chain. Implementations must be deterministic and side-effect free.
 */
@FunctionalInterface
public interface ExternalErrorClassifier {

  /**
   * Classifies an external error.
   *
   * @param external the error thrown by the collaborator
   * @return the classification, or empty if this classifier does not recognise the error
   */
  Optional<Classification> classify(Throwable external);
}
