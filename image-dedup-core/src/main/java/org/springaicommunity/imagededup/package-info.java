/**
 * Duplicate image detection: normalization, pairwise comparison, grouping, retention
 * and run reports. {@link org.springaicommunity.imagededup.ImageDedupBuilder} wires a
 * {@link org.springaicommunity.imagededup.DuplicateImageService} without Spring.
 *
 * <p>
 * Null-marked: reference types are non-null unless annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.imagededup;

import org.jspecify.annotations.NullMarked;
