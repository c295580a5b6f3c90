package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.util.Arrays;

/**
 * A two dimensional array of floating point pixel values. Pixels are stored
 * row by row, so pixel (x,y) lives at index {@code x + y * width}.
 * <p>
 * Every operation which extracts part of an image returns a copy, the
 * processing code never holds on to, or modifies, an image it was given.
 */
public class FlatImage {

    private final int width;
    private final int height;
    private final double[] data;

    public FlatImage(int width, int height) {
        this(width, height, new double[width * height]);
    }

    /**
     * Wrap existing pixel data. The array is used directly, not copied.
     *
     * @param width The image width
     * @param height The image height
     * @param data The pixel data, of length width*height
     */
    public FlatImage(int width, int height, double[] data) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new ShapeException("Pixel array of length " + data.length + " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public static FlatImage fromArray(double[][] pixels) {
        int height = pixels.length;
        int width = height == 0 ? 0 : pixels[0].length;
        FlatImage image = new FlatImage(width, height);
        for (int y = 0; y < height; y++) {
            if (pixels[y].length != width) {
                throw new ShapeException("Ragged pixel array at row " + y);
            }
            System.arraycopy(pixels[y], 0, image.data, y * width, width);
        }
        return image;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Rectangle getBounds() {
        return new Rectangle(0, 0, width, height);
    }

    public double get(int x, int y) {
        return data[x + y * width];
    }

    public void set(int x, int y, double value) {
        data[x + y * width] = value;
    }

    /**
     * Direct access to the pixel buffer, used by the numerical loops.
     *
     * @return The backing array
     */
    double[] getData() {
        return data;
    }

    public FlatImage copy() {
        return new FlatImage(width, height, data.clone());
    }

    /**
     * Copy a rectangular part of this image.
     *
     * @param box The area to copy, which must lie within the image
     * @return A new image containing a copy of the pixels
     */
    public FlatImage subImage(Rectangle box) {
        if (!getBounds().contains(box)) {
            throw new ShapeException("Region " + box + " is outside image of size " + width + "x" + height);
        }
        FlatImage result = new FlatImage(box.width, box.height);
        for (int y = 0; y < box.height; y++) {
            System.arraycopy(data, box.x + (box.y + y) * width, result.data, y * box.width, box.width);
        }
        return result;
    }

    /**
     * Copy the image with {@code border} pixels removed from every side.
     *
     * @param border The number of pixels to remove
     * @return The cropped copy
     */
    public FlatImage crop(int border) {
        return subImage(interior(border));
    }

    /**
     * The rectangle left once {@code border} pixels are removed from each side.
     * The result is empty if the border consumes the whole image.
     *
     * @param border The number of pixels to remove
     * @return The interior rectangle
     */
    public Rectangle interior(int border) {
        return new Rectangle(border, border, Math.max(0, width - 2 * border), Math.max(0, height - 2 * border));
    }

    /**
     * Copy the pixels of a rectangular area into a flat array.
     *
     * @param box The area, which must lie within the image
     * @return The pixel values, row by row
     */
    public double[] values(Rectangle box) {
        return subImage(box).data;
    }

    public void scale(double factor) {
        for (int i = 0; i < data.length; i++) {
            data[i] *= factor;
        }
    }

    public void add(double value) {
        for (int i = 0; i < data.length; i++) {
            data[i] += value;
        }
    }

    public void subtract(FlatImage other) {
        checkSameSize(other);
        for (int i = 0; i < data.length; i++) {
            data[i] -= other.data[i];
        }
    }

    public void multiply(FlatImage other) {
        checkSameSize(other);
        for (int i = 0; i < data.length; i++) {
            data[i] *= other.data[i];
        }
    }

    private void checkSameSize(FlatImage other) {
        if (other.width != width || other.height != height) {
            throw new ShapeException("Image size mismatch " + width + "x" + height + " vs " + other.width + "x" + other.height);
        }
    }

    @Override
    public String toString() {
        return "FlatImage{" + "width=" + width + ", height=" + height + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + width;
        hash = 37 * hash + height;
        hash = 37 * hash + Arrays.hashCode(data);
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
        final FlatImage other = (FlatImage) obj;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }
}
