/**
 * Device relay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.devicerelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.devicerelay.cli.DeviceRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.devicerelay.runtime.DeviceRelayRuntime} parses, grades, charges and queues commands.</li>
 *   <li>{@code io.devicerelay.storage.CommandStore} is the authoritative command state machine.</li>
 * </ul>
 */
package io.devicerelay;
