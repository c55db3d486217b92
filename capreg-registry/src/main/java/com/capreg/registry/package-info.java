/**
 * Capability catalog core.
 * <ul>
 *   <li>{@link com.capreg.registry.Capability} – contract for registrable values (id + type)</li>
 *   <li>{@link com.capreg.registry.Entry} – immutable stored snapshot (version, timestamps, tombstone)</li>
 *   <li>{@link com.capreg.registry.Catalog} – operation set; {@link com.capreg.registry.InMemoryCatalog} is the in-process implementation</li>
 *   <li>{@link com.capreg.registry.CatalogException} – InvalidArgument, NotFound, AlreadyExists</li>
 *   <li>{@link com.capreg.registry.EntryJson} – wire codec</li>
 * </ul>
 */
package com.capreg.registry;
