package com.pyscope.ast;

/**
 * Compound statements whose lines split into sub-blocks.
 *
 * @see com.pyscope.tree.BlockRanges
 */
public sealed interface BlockRange extends Node permits If, For, While, With, TryExcept, TryFinally {
}
