package org.hivemind.runtime.model.component;

/**
 * Health component of an entity. Damage is applied by the surrounding combat system.
 */
public class Health {

    private double current;
    private final double maximum;

    public Health(double maximum) {
        this(maximum, maximum);
    }

    public Health(double current, double maximum) {
        this.current = current;
        this.maximum = maximum;
    }

    public double getCurrent() {
        return current;
    }

    public void setCurrent(double current) {
        this.current = Math.min(current, maximum);
    }

    public void damage(double amount) {
        this.current -= amount;
    }

    public double getMaximum() {
        return maximum;
    }

    /**
     * @return current / maximum, or 0 if the maximum is not positive.
     */
    public double getFraction() {
        return maximum > 0 ? current / maximum : 0.0;
    }

    public boolean isDepleted() {
        return current <= 0;
    }
}
