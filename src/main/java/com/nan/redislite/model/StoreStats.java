package com.nan.redislite.model;

/*
  Point-in-time size of the shared store.
  - size:     live keys
  - capacity: current bucket count (doubles as the store grows)
*/
public class StoreStats {
    private int size;
    private int capacity;

    public StoreStats() {}

    public StoreStats(int size, int capacity) {
        this.size = size;
        this.capacity = capacity;
    }

    public int getSize() { return size; }
    public int getCapacity() { return capacity; }

    public void setSize(int size) { this.size = size; }
    public void setCapacity(int capacity) { this.capacity = capacity; }
}
