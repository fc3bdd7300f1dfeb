package org.dynamis.exprtree.benchmark.domain;

public class FactionState {

    private int influence;
    private int stability;
    private Credits treasury = new Credits(0);
    private final Credits[] tribute = {new Credits(0), new Credits(0), new Credits(0)};

    public int getInfluence() {
        return influence;
    }

    public void setInfluence(int influence) {
        this.influence = influence;
    }

    public int getStability() {
        return stability;
    }

    public void setStability(int stability) {
        this.stability = stability;
    }

    public Credits getTreasury() {
        return treasury;
    }

    public void setTreasury(Credits treasury) {
        this.treasury = treasury;
    }

    public Credits get(int season) {
        return tribute[season];
    }

    public void set(int season, Credits amount) {
        tribute[season] = amount;
    }
}
