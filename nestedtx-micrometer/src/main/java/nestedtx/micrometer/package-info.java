/**
 * Micrometer metrics for the nested transaction coordinator.
 *
 * @see nestedtx.micrometer.MicrometerTxObserver
 */
package nestedtx.micrometer;
