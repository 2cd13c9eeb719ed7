// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.List;

/// Which regions sit next to each other. Neighbours are consecutive entries of a fixed chain of kinds.
/// Compound regions are neighbours when they differ in exactly one component and those components are neighbours.
final class RegionAdjacency {

  private static final List<List<RegionKind>> CHAINS = List.of(
      List.of(RegionKind.NUMBER_NEGATIVE_INFINITY, RegionKind.NUMBER_NEGATIVE, RegionKind.NUMBER_ZERO,
          RegionKind.NUMBER_POSITIVE, RegionKind.NUMBER_POSITIVE_INFINITY),
      List.of(RegionKind.STRING_EMPTY, RegionKind.STRING_SINGLE, RegionKind.STRING_SHORT, RegionKind.STRING_MEDIUM,
          RegionKind.STRING_LONG, RegionKind.STRING_VERY_LONG),
      List.of(RegionKind.ARRAY_EMPTY, RegionKind.ARRAY_SINGLE, RegionKind.ARRAY_MULTIPLE),
      List.of(RegionKind.OBJECT_EMPTY, RegionKind.OBJECT_PARTIAL, RegionKind.OBJECT_COMPLETE));

  private RegionAdjacency() {
  }

  static boolean areAdjacent(TypeSpaceRegion a, TypeSpaceRegion b) {
    if (a.isCompound() && b.isCompound()) {
      if (a.components().size() != b.components().size()) {
        return false;
      }
      int differing = -1;
      for (int i = 0; i < a.components().size(); i++) {
        if (!a.components().get(i).id().equals(b.components().get(i).id())) {
          if (differing >= 0) {
            return false;
          }
          differing = i;
        }
      }
      return differing >= 0 && areAdjacent(a.components().get(differing), b.components().get(differing));
    }
    if (a.isCompound() || b.isCompound()) {
      return false;
    }
    for (List<RegionKind> chain : CHAINS) {
      final int i = chain.indexOf(a.kind());
      final int j = chain.indexOf(b.kind());
      if (i >= 0 && j >= 0 && Math.abs(i - j) == 1) {
        return true;
      }
    }
    return false;
  }
}
