package net.larse.seas.timeseries;

/** How a series is extended beyond its ends before a trend is computed. */
public enum EdgeHandling {
  /** No extension. */
  NONE,
  /** Repeat the first and last observations in their original order. */
  EXTEND,
  /** Reflect the first and last observations, the edge observation included. */
  MIRROR
}
