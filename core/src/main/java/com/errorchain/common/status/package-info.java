/**
 * Contains the error value model and the protocol for propagating it.
 *
 * <p>This package provides a consistent way to represent failures as values that can cross layers
 * without losing context. The central classes are:
 *
 * <ul>
 *   <li>{@link com.errorchain.common.status.ErrorKind} - The closed set of error kinds</li>
 *   <li>{@link com.errorchain.common.status.ErrorValue} - An immutable, chainable, type-erased
 *       error node</li>
 *   <li>{@link com.errorchain.common.status.ErrorFactory} - Creates terminal errors and converts
 *       external ones</li>
 *   <li>{@link com.errorchain.common.status.ErrorOr} - Container that holds either a successful
 *       value or an error</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * // Lowest layer: convert the collaborator's exception at the boundary
 * ErrorOr&lt;String&gt; readConfig(Path path) {
 *     return ErrorOr.catching(() -&gt; Files.readString(path));
 * }
 *
 * // Module boundary: wrap with what this layer was doing
 * ErrorOr&lt;Config&gt; loadConfig(Path path) {
 *     return readConfig(path)
 *         .wrapError(ErrorKind.IO, "while reading " + path)
 *         .flatMap(this::parse);
 * }
 *
 * // Anticipated failure: recover with a fallback
 * ErrorOr&lt;Config&gt; config = loadConfig(path)
 *     .recoverIf(NoSuchFileException.class, missing -&gt; ErrorOr.ofValue(Config.defaults()));
 *
 * // Top level: render and exit
 * if (config.isNotOk()) {
 *     System.err.println(config.getError().render());
 *     System.exit(config.getError().kind().exitStatus());
 * }
 * </pre>
 */
package com.errorchain.common.status;
