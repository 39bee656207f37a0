/* (C)2026 */
package com.ammann.fedstats.model;

/**
 * Training and held-out partitions of a site's dataset.
 */
public record TrainTestSplit(Dataset train, Dataset heldOut) {}
