/*-
 * #%L
 * This file is part of FaceFit.
 * %%
 * Copyright (C) 2024 FaceFit developers
 * %%
 * FaceFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * FaceFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with FaceFit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package facefit.lib.analysis.images;

import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

import facefit.lib.common.GeneralTools;

/**
 * Create {@link SimpleImage SimpleImage} and {@link SimpleBinaryImage} instances for basic pixel processing.
 */
public class SimpleImages {
	
	/**
	 * Function used to compute a pixel value from its coordinates.
	 */
	@FunctionalInterface
	public static interface PixelFunction {
		
		/**
		 * Compute the value for pixel (x, y).
		 * @param x
		 * @param y
		 * @return
		 */
		double apply(int x, int y);
		
	}
	
	/**
	 * Predicate used to decide whether a pixel is foreground from its coordinates.
	 */
	@FunctionalInterface
	public static interface PixelPredicate {
		
		/**
		 * Returns true if pixel (x, y) should be set.
		 * @param x
		 * @param y
		 * @return
		 */
		boolean test(int x, int y);
		
	}
	
	/**
	 * Get the pixel values for the image, in row-major order.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static double[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage && ((SimpleModifiableImage)image).getPixelOrder() == PixelOrder.ROW_MAJOR)
			return ((SimpleModifiableImage)image).getArray(direct);
		int w = image.getWidth();
		int n = w * image.getHeight();
		double[] pixels = new double[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing double array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createDoubleImage(double[] data, int width, int height) {
		return createDoubleImage(data, width, height, PixelOrder.ROW_MAJOR);
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing double array of pixels, stored in the specified order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @param order
	 * @return
	 */
	public static SimpleModifiableImage createDoubleImage(double[] data, int width, int height, PixelOrder order) {
		return new DoubleArraySimpleImage(data, width, height, order);
	}

	/**
	 * Create a {@link SimpleImage} backed by a row-major double array of pixels, initialized to zero.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createDoubleImage(int width, int height) {
		return createDoubleImage(width, height, PixelOrder.ROW_MAJOR);
	}
	
	/**
	 * Create a {@link SimpleImage} backed by a double array of pixels in the specified order, initialized to zero.
	 *
	 * @param width
	 * @param height
	 * @param order
	 * @return
	 */
	public static SimpleModifiableImage createDoubleImage(int width, int height, PixelOrder order) {
		GeneralTools.checkDimensions(width, height);
		return new DoubleArraySimpleImage(new double[width * height], width, height, order);
	}
	
	/**
	 * Create a row-major {@link SimpleImage} by evaluating a function at every pixel.
	 * 
	 * @param width
	 * @param height
	 * @param fun
	 * @return
	 */
	public static SimpleModifiableImage createDoubleImage(int width, int height, PixelFunction fun) {
		var img = createDoubleImage(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				img.setValue(x, y, fun.apply(x, y));
			}
		}
		return img;
	}
	
	/**
	 * Create a {@link SimpleBinaryImage} backed by an existing boolean array, in row-major order.
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleBinaryImage createBinaryImage(boolean[] data, int width, int height) {
		return new BooleanArraySimpleImage(data, width, height);
	}
	
	/**
	 * Create a {@link SimpleBinaryImage} by evaluating a predicate at every pixel.
	 * @param width
	 * @param height
	 * @param predicate
	 * @return
	 */
	public static SimpleBinaryImage createBinaryImage(int width, int height, PixelPredicate predicate) {
		GeneralTools.checkDimensions(width, height);
		boolean[] data = new boolean[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				data[y * width + x] = predicate.test(x, y);
			}
		}
		return new BooleanArraySimpleImage(data, width, height);
	}
	
	/**
	 * Create a binary image by applying a predicate to every pixel value of an image.
	 * @param image
	 * @param predicate
	 * @return
	 */
	public static SimpleBinaryImage threshold(SimpleImage image, DoublePredicate predicate) {
		return createBinaryImage(image.getWidth(), image.getHeight(), (x, y) -> predicate.test(image.getValue(x, y)));
	}
	
	/**
	 * Create a new binary image in which foreground and background are swapped.
	 * @param image
	 * @return
	 */
	public static SimpleBinaryImage invert(SimpleBinaryImage image) {
		return createBinaryImage(image.getWidth(), image.getHeight(), (x, y) -> !image.isSet(x, y));
	}
	
	/**
	 * Create a new image by applying a function to every pixel value. 
	 * The input image is unchanged, and the output uses the same pixel order if the input is array-backed.
	 * @param image
	 * @param op
	 * @return
	 */
	public static SimpleModifiableImage map(SimpleImage image, DoubleUnaryOperator op) {
		int w = image.getWidth();
		int h = image.getHeight();
		PixelOrder order = image instanceof SimpleModifiableImage ? ((SimpleModifiableImage)image).getPixelOrder() : PixelOrder.ROW_MAJOR;
		var output = createDoubleImage(w, h, order);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				output.setValue(x, y, op.applyAsDouble(image.getValue(x, y)));
			}
		}
		return output;
	}
	
	/**
	 * Create a row-major image where each pixel is 0 for foreground and the specified value for background.
	 * @param mask
	 * @param backgroundValue
	 * @return
	 */
	public static SimpleModifiableImage seed(SimpleBinaryImage mask, double backgroundValue) {
		return createDoubleImage(mask.getWidth(), mask.getHeight(), (x, y) -> mask.isSet(x, y) ? 0.0 : backgroundValue);
	}
	
	/**
	 * Create a copy of an image, using the same pixel order if the input is array-backed.
	 * @param image
	 * @return
	 */
	public static SimpleModifiableImage copy(SimpleImage image) {
		if (image instanceof SimpleModifiableImage) {
			var img = (SimpleModifiableImage)image;
			return createDoubleImage(img.getArray(false), img.getWidth(), img.getHeight(), img.getPixelOrder());
		}
		return map(image, DoubleUnaryOperator.identity());
	}
	
	/**
	 * Extract a row of pixel values.
	 * @param image
	 * @param y
	 * @return
	 */
	public static double[] getRow(SimpleImage image, int y) {
		Objects.checkIndex(y, image.getHeight());
		double[] row = new double[image.getWidth()];
		// Only read the backing array directly; other modifiable images may copy all pixels in getArray
		if (image instanceof DoubleArraySimpleImage) {
			var img = (DoubleArraySimpleImage)image;
			img.getPixelOrder().getRow(img.getArray(true), img.getWidth(), img.getHeight(), y, row);
		} else {
			for (int x = 0; x < row.length; x++)
				row[x] = image.getValue(x, y);
		}
		return row;
	}
	
	/**
	 * Extract a column of pixel values.
	 * @param image
	 * @param x
	 * @return
	 */
	public static double[] getColumn(SimpleImage image, int x) {
		Objects.checkIndex(x, image.getWidth());
		double[] column = new double[image.getHeight()];
		// Only read the backing array directly; other modifiable images may copy all pixels in getArray
		if (image instanceof DoubleArraySimpleImage) {
			var img = (DoubleArraySimpleImage)image;
			img.getPixelOrder().getColumn(img.getArray(true), img.getWidth(), img.getHeight(), x, column);
		} else {
			for (int y = 0; y < column.length; y++)
				column[y] = image.getValue(x, y);
		}
		return column;
	}
	
	/**
	 * Returns true if two images have the same width and height.
	 * @param image1
	 * @param image2
	 * @return
	 */
	public static boolean sameSize(SimpleImage image1, SimpleImage image2) {
		return image1.getWidth() == image2.getWidth() && image1.getHeight() == image2.getHeight();
	}
	
	
	/**
	 * Implementation of a SimpleImage backed by an array of doubles.
	 */
	static class DoubleArraySimpleImage implements SimpleModifiableImage {

		private final double[] data;
		private final int width;
		private final int height;
		private final PixelOrder order;
		
		DoubleArraySimpleImage(double[] data, int width, int height, PixelOrder order) {
			GeneralTools.checkDimensions(width, height);
			Objects.requireNonNull(order, "Pixel order must not be null");
			if (data.length != width * height)
				throw new IllegalArgumentException("Data length " + data.length + " does not match image size " + width + "x" + height);
			this.data = data;
			this.width = width;
			this.height = height;
			this.order = order;
		}
		
		@Override
		public double getValue(int x, int y) {
			return data[order.getIndex(Objects.checkIndex(x, width), Objects.checkIndex(y, height), width, height)];
		}

		@Override
		public void setValue(int x, int y, double val) {
			data[order.getIndex(Objects.checkIndex(x, width), Objects.checkIndex(y, height), width, height)] = val;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}
		
		@Override
		public double[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}
		
		@Override
		public PixelOrder getPixelOrder() {
			return order;
		}
		
		@Override
		public String toString() {
			return "DoubleArraySimpleImage (" + width + "x" + height + ", " + order + ")";
		}

	}
	
	
	/**
	 * Implementation of a SimpleBinaryImage backed by a row-major array of booleans.
	 */
	static class BooleanArraySimpleImage implements SimpleBinaryImage {
		
		private final boolean[] data;
		private final int width;
		private final int height;
		
		BooleanArraySimpleImage(boolean[] data, int width, int height) {
			GeneralTools.checkDimensions(width, height);
			if (data.length != width * height)
				throw new IllegalArgumentException("Data length " + data.length + " does not match image size " + width + "x" + height);
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public boolean isSet(int x, int y) {
			return data[Objects.checkIndex(y, height) * width + Objects.checkIndex(x, width)];
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}
		
	}
	
}
