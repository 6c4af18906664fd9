/**
 * Pure domain services.
 *
 * <p>Stateless static utilities for input validation and guarded arithmetic.
 *
 * <h3>Responsibilities:</h3>
 *
 * <ul>
 *   <li>Finite-number gate and sign/zero/range validators
 *   <li>Binary arithmetic with overflow detection
 *   <li>No framework dependencies, no logging
 * </ul>
 *
 * @since 0.1
 */
package guarded.calculator.domain.service;
