/**
 * Runtime coordination package.
 *
 * <p>{@link io.tongchi.runtime.TongchiRuntime} owns component wiring, settings reload,
 * the activity journal and the stats surface used by the CLI and the tray front end.
 */
package io.tongchi.runtime;
