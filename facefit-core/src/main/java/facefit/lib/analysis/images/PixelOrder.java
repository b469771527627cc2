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

/**
 * Storage order of pixels in a 1D array backing a 2D image.
 * <p>
 * The order is chosen once when an image is created, and determines how linear indices are 
 * computed and how whole rows and columns are copied in and out of the array.
 */
public enum PixelOrder {
	
	/**
	 * Pixels of each row are contiguous (x varies fastest).
	 */
	ROW_MAJOR {
		@Override
		public int getIndex(int x, int y, int width, int height) {
			return y * width + x;
		}

		@Override
		public int getX(int index, int width, int height) {
			return index % width;
		}

		@Override
		public int getY(int index, int width, int height) {
			return index / width;
		}

		@Override
		public void getRow(double[] data, int width, int height, int y, double[] row) {
			System.arraycopy(data, y * width, row, 0, width);
		}

		@Override
		public void setRow(double[] data, int width, int height, int y, double[] row) {
			System.arraycopy(row, 0, data, y * width, width);
		}
	},
	
	/**
	 * Pixels of each column are contiguous (y varies fastest).
	 */
	COLUMN_MAJOR {
		@Override
		public int getIndex(int x, int y, int width, int height) {
			return x * height + y;
		}

		@Override
		public int getX(int index, int width, int height) {
			return index / height;
		}

		@Override
		public int getY(int index, int width, int height) {
			return index % height;
		}
		
		@Override
		public void getColumn(double[] data, int width, int height, int x, double[] column) {
			System.arraycopy(data, x * height, column, 0, height);
		}

		@Override
		public void setColumn(double[] data, int width, int height, int x, double[] column) {
			System.arraycopy(column, 0, data, x * height, height);
		}
	};
	
	/**
	 * Get the linear index of pixel (x, y).
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public abstract int getIndex(int x, int y, int width, int height);
	
	/**
	 * Get the x coordinate of a linear index.
	 * @param index
	 * @param width
	 * @param height
	 * @return
	 */
	public abstract int getX(int index, int width, int height);

	/**
	 * Get the y coordinate of a linear index.
	 * @param index
	 * @param width
	 * @param height
	 * @return
	 */
	public abstract int getY(int index, int width, int height);
	
	/**
	 * Copy row y of the data array into the row array, which must have length &ge; width.
	 * @param data
	 * @param width
	 * @param height
	 * @param y
	 * @param row
	 */
	public void getRow(double[] data, int width, int height, int y, double[] row) {
		for (int x = 0; x < width; x++)
			row[x] = data[getIndex(x, y, width, height)];
	}

	/**
	 * Copy the row array into row y of the data array.
	 * @param data
	 * @param width
	 * @param height
	 * @param y
	 * @param row
	 */
	public void setRow(double[] data, int width, int height, int y, double[] row) {
		for (int x = 0; x < width; x++)
			data[getIndex(x, y, width, height)] = row[x];
	}
	
	/**
	 * Copy column x of the data array into the column array, which must have length &ge; height.
	 * @param data
	 * @param width
	 * @param height
	 * @param x
	 * @param column
	 */
	public void getColumn(double[] data, int width, int height, int x, double[] column) {
		for (int y = 0; y < height; y++)
			column[y] = data[getIndex(x, y, width, height)];
	}

	/**
	 * Copy the column array into column x of the data array.
	 * @param data
	 * @param width
	 * @param height
	 * @param x
	 * @param column
	 */
	public void setColumn(double[] data, int width, int height, int x, double[] column) {
		for (int y = 0; y < height; y++)
			data[getIndex(x, y, width, height)] = column[y];
	}

}
