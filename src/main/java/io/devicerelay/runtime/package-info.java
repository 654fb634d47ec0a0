/**
 * Relay orchestration.
 *
 * <p>{@link io.devicerelay.runtime.DeviceRelayRuntime} is the operator surface: send, confirm,
 * reject, cancel and read. {@link io.devicerelay.runtime.DeliveryProtocol} is the device
 * surface used by the HTTP layer. Both keep all cross-request state in the store.
 */
package io.devicerelay.runtime;
