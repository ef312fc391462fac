/**
 * Immutable country, city and relay hierarchy.
 *
 * <p>{@link io.relayindex.relaylist.RelayList} is built once from a
 * {@link io.relayindex.model.RelayListModel} and then only read. Every
 * {@link io.relayindex.relaylist.Relay} carries its full country/city path, so no node
 * holds a reference to its parent.
 */
package io.relayindex.relaylist;
