package com.rankbox.engine.model;

/**
 * How often an item was offered in a group of three or more, and how often it was picked.
 */
public final class GroupSelections {

    private int chosen;
    private int appearances;

    public GroupSelections() {}

    public GroupSelections(int chosen, int appearances) {
        this.chosen = chosen;
        this.appearances = appearances;
    }

    public void recordAppearance(boolean picked) {
        appearances++;
        if (picked) {
            chosen++;
        }
    }

    /**
     * Moves the pick of an already counted group presentation to or away from this item.
     */
    public void changeChoice(boolean picked) {
        if (picked) {
            chosen = Math.min(chosen + 1, appearances);
        } else if (chosen > 0) {
            chosen--;
        }
    }

    /**
     * Chosen/appearances ratio, or the neutral 0.5 when the item was never offered in a group.
     */
    public double getChosenRatio() {
        return appearances > 0 ? (double) chosen / appearances : 0.5;
    }

    public GroupSelections copy() {
        return new GroupSelections(chosen, appearances);
    }

    public int getChosen() { return chosen; }

    public int getAppearances() { return appearances; }
}
