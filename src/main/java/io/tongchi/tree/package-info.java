/**
 * Lazily populated resource hierarchies fed by pluggable {@link io.tongchi.tree.Lister}s.
 */
package io.tongchi.tree;
