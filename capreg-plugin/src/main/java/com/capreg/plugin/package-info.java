/**
 * Plugin loading for the capability catalog. Modules are JARs in a controlled directory that publish
 * {@link com.capreg.plugin.RegistrationHook}s via {@link java.util.ServiceLoader}.
 * <ul>
 *   <li>{@link com.capreg.plugin.RegistrationHook} – SPI: register(Catalog)</li>
 *   <li>{@link com.capreg.plugin.PluginLoader} – scan, validate, invoke; built-in hooks</li>
 *   <li>{@link com.capreg.plugin.RestrictedPluginClassLoader} – hardened parent for module JARs</li>
 *   <li>{@link com.capreg.plugin.LoadPolicy}, {@link com.capreg.plugin.LoadReport} – failure aggregation</li>
 *   <li>{@link com.capreg.plugin.PluginLoadException}, {@link com.capreg.plugin.PluginContractException},
 *       {@link com.capreg.plugin.PluginRegistrationException} – per-module failures</li>
 * </ul>
 */
package com.capreg.plugin;
