/**
 * Tongchi core source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tongchi.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tongchi.runtime.TongchiRuntime} wires trees, scheduled tasks, alerts and processes.</li>
 *   <li>{@code io.tongchi.tree.ResourceTree} is the cached, lazily loaded resource hierarchy.</li>
 *   <li>{@code io.tongchi.schedule.ScheduledTaskRunner} drives renewals and status polling.</li>
 * </ul>
 */
package io.tongchi;
