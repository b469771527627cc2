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

package facefit.lib.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.geom.Point2;
import facefit.lib.landmarks.Landmark2D;
import facefit.lib.landmarks.LandmarkDetectionMap;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * several key classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link SimpleImage} (always read back as a row-major array-backed image)</li>
 * <li>{@link LandmarkDetectionMap}</li>
 * <li>{@link Landmark2D}</li>
 * </ul>
 * Infinite values are written as the literals {@code Infinity} and {@code -Infinity}, 
 * since detection maps use {@code -Infinity} for impossible positions.
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new FaceFitTypeAdapterFactory());
	
	/**
	 * Get a default Gson, capable of handling FaceFit types.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get a default Gson, optionally with pretty printing enabled.
	 * @param pretty if true, request pretty-printing
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	
	static class FaceFitTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor(type.getRawType());
		}
		
		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (SimpleImage.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)SimpleImageTypeAdapter.INSTANCE.nullSafe();
			
			if (LandmarkDetectionMap.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)LandmarkDetectionMapTypeAdapter.INSTANCE.nullSafe();
			
			if (Landmark2D.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)Landmark2DTypeAdapter.INSTANCE.nullSafe();

			return null;
		}
		
	}
	
	
	static class SimpleImageTypeAdapter extends TypeAdapter<SimpleImage> {
		
		static SimpleImageTypeAdapter INSTANCE = new SimpleImageTypeAdapter();

		@Override
		public void write(JsonWriter out, SimpleImage image) throws IOException {
			out.beginObject();
			out.name("width");
			out.value(image.getWidth());
			out.name("height");
			out.value(image.getHeight());
			out.name("values");
			out.beginArray();
			for (double v : SimpleImages.getPixels(image, true))
				out.value(v);
			out.endArray();
			out.endObject();
		}

		@Override
		public SimpleImage read(JsonReader in) throws IOException {
			int width = -1;
			int height = -1;
			double[] values = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "width":
					width = in.nextInt();
					break;
				case "height":
					height = in.nextInt();
					break;
				case "values":
					values = readDoubles(in);
					break;
				default:
					logger.debug("Skipping unknown image property '{}'", name);
					in.skipValue();
				}
			}
			in.endObject();
			if (values == null)
				throw new JsonParseException("Image has no values");
			try {
				return SimpleImages.createDoubleImage(values, width, height);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid image: " + e.getLocalizedMessage(), e);
			}
		}
		
		private static double[] readDoubles(JsonReader in) throws IOException {
			List<Double> list = new ArrayList<>();
			in.beginArray();
			while (in.hasNext())
				list.add(in.nextDouble());
			in.endArray();
			return list.stream().mapToDouble(Double::doubleValue).toArray();
		}
		
	}
	
	
	static class LandmarkDetectionMapTypeAdapter extends TypeAdapter<LandmarkDetectionMap> {
		
		static LandmarkDetectionMapTypeAdapter INSTANCE = new LandmarkDetectionMapTypeAdapter();

		@Override
		public void write(JsonWriter out, LandmarkDetectionMap map) throws IOException {
			out.beginObject();
			out.name("tag");
			out.value(map.getTag());
			out.name("logValues");
			SimpleImageTypeAdapter.INSTANCE.write(out, map.getLogValues());
			out.endObject();
		}

		@Override
		public LandmarkDetectionMap read(JsonReader in) throws IOException {
			String tag = null;
			SimpleImage logValues = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				if ("tag".equals(name))
					tag = in.nextString();
				else if ("logValues".equals(name))
					logValues = SimpleImageTypeAdapter.INSTANCE.read(in);
				else {
					logger.debug("Skipping unknown detection map property '{}'", name);
					in.skipValue();
				}
			}
			in.endObject();
			if (tag == null || logValues == null)
				throw new JsonParseException("Detection map requires both 'tag' and 'logValues'");
			return new LandmarkDetectionMap(tag, logValues);
		}
		
	}
	
	
	static class Landmark2DTypeAdapter extends TypeAdapter<Landmark2D> {
		
		static Landmark2DTypeAdapter INSTANCE = new Landmark2DTypeAdapter();

		@Override
		public void write(JsonWriter out, Landmark2D landmark) throws IOException {
			out.beginObject();
			out.name("id");
			out.value(landmark.getId());
			out.name("x");
			out.value(landmark.getPoint().getX());
			out.name("y");
			out.value(landmark.getPoint().getY());
			out.name("visible");
			out.value(landmark.isVisible());
			out.endObject();
		}

		@Override
		public Landmark2D read(JsonReader in) throws IOException {
			String id = null;
			double x = Double.NaN;
			double y = Double.NaN;
			// Landmarks are visible unless stated otherwise
			boolean visible = true;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "id":
					id = in.nextString();
					break;
				case "x":
					x = in.nextDouble();
					break;
				case "y":
					y = in.nextDouble();
					break;
				case "visible":
					visible = in.nextBoolean();
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (id == null || Double.isNaN(x) || Double.isNaN(y))
				throw new JsonParseException("Landmark requires 'id', 'x' and 'y'");
			return new Landmark2D(id, new Point2(x, y), visible);
		}
		
	}

}
