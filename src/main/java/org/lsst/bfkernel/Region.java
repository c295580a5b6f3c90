package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.Objects;

/**
 * A named rectangular area of a detector image, either one amplifier or the
 * whole detector.
 */
public class Region {

    private final String name;
    private final Rectangle bbox;

    public Region(String name, Rectangle bbox) {
        this.name = Objects.requireNonNull(name, "name");
        this.bbox = new Rectangle(Objects.requireNonNull(bbox, "bbox"));
    }

    public String getName() {
        return name;
    }

    public Rectangle getBBox() {
        return new Rectangle(bbox);
    }

    @Override
    public String toString() {
        return "Region{" + "name=" + name + ", bbox=[" + bbox.x + "," + bbox.y + " " + bbox.width + "x" + bbox.height + "]}";
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 41 * hash + Objects.hashCode(this.name);
        hash = 41 * hash + Objects.hashCode(this.bbox);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Region other = (Region) obj;
        return Objects.equals(this.name, other.name) && Objects.equals(this.bbox, other.bbox);
    }
}
