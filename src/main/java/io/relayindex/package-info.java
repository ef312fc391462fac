/**
 * RelayIndex source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.relayindex.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.relayindex.cli.RelayIndexCommand} maps commands to relay list lookups.</li>
 *   <li>{@code io.relayindex.relaylist.RelayList} owns the country, city and relay hierarchy.</li>
 *   <li>{@code io.relayindex.storage.RelayListLoader} reads the relay list model from JSON.</li>
 * </ul>
 */
package io.relayindex;
