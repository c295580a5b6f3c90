package org.lsst.bfkernel.fits;

import java.awt.Rectangle;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A FITS section keyword such as DATASEC or DETSEC, {@code [x1:x2,y1:y2]} with
 * 1-based inclusive bounds. A section whose start is larger than its end is
 * flipped along that axis.
 */
class Section {

    private static final Pattern SECTION_PATTERN = Pattern.compile("\\[(\\d+):(\\d+),(\\d+):(\\d+)\\]");

    private final int x1;
    private final int x2;
    private final int y1;
    private final int y2;

    private Section(int x1, int x2, int y1, int y2) {
        this.x1 = x1;
        this.x2 = x2;
        this.y1 = y1;
        this.y2 = y2;
    }

    static Section parse(String text) throws IOException {
        if (text == null) {
            throw new IOException("Missing section");
        }
        Matcher matcher = SECTION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IOException("Invalid section: " + text);
        }
        return new Section(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(4)));
    }

    /**
     * @return The 0-based bounding box of the section
     */
    Rectangle getBounds() {
        int x = Math.min(x1, x2) - 1;
        int y = Math.min(y1, y2) - 1;
        return new Rectangle(x, y, getWidth(), getHeight());
    }

    int getWidth() {
        return Math.abs(x2 - x1) + 1;
    }

    int getHeight() {
        return Math.abs(y2 - y1) + 1;
    }

    boolean isFlippedX() {
        return x1 > x2;
    }

    boolean isFlippedY() {
        return y1 > y2;
    }

    @Override
    public String toString() {
        return "[" + x1 + ":" + x2 + "," + y1 + ":" + y2 + "]";
    }
}
