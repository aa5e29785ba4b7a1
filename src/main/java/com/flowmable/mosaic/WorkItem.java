package com.flowmable.mosaic;

/**
 * One unit of matching work: a cell's signature plus where its tile will be pasted.
 */
public record WorkItem(CellCoordinate cell, PixelRegion region, Signature signature) {}
