package com.pyscope.tree;

public record LineRange(int from, int to) {
}
