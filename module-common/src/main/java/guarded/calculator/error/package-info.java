/**
 * Calculator error taxonomy.
 *
 * <p>Error codes and the exception hierarchy rooted at {@link
 * guarded.calculator.error.exception.base.BaseException}. Every exception is unchecked and is raised
 * synchronously to the immediate caller.
 *
 * @since 0.1
 */
package guarded.calculator.error;
