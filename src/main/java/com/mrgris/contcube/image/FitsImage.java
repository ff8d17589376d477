package com.mrgris.contcube.image;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.mrgris.contcube.BeamMetadataError;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;

/**
 * A single-HDU FITS raster held in memory as a flat float array in FITS axis order (NAXIS1
 * varies fastest).
 */
public class FitsImage {

	private static final Logger LOG = LoggerFactory.getLogger(FitsImage.class);

	static final Set<String> STRUCTURAL_KEYS = ImmutableSet.of(
			"SIMPLE", "XTENSION", "BITPIX", "NAXIS", "EXTEND", "PCOUNT", "GCOUNT", "BSCALE", "BZERO", "END");

	public final String path;
	public final Header header;
	public final int[] shape;
	public final float[] data;

	// keyword updates applied on write; the source header is never modified
	final Map<String, Object[]> updates = new LinkedHashMap<>();

	FitsImage(String path, Header header, int[] shape, float[] data) {
		if (data.length != pixelCount(shape)) {
			throw new IllegalArgumentException("data does not match shape");
		}
		this.path = path;
		this.header = header;
		this.shape = shape;
		this.data = data;
	}

	public static FitsImage read(String path) throws IOException {
		try (Fits fits = new Fits(new File(path))) {
			BasicHDU<?> hdu = fits.readHDU();
			if (hdu == null) {
				throw new IOException("no HDU in " + path);
			}
			int[] shape = hdu.getAxes().clone();
			reverse(shape);
			Object flat = ArrayFuncs.flatten(hdu.getKernel());
			float[] data = (float[])ArrayFuncs.convertArray(flat, float.class);
			return new FitsImage(path, hdu.getHeader(), shape, data);
		} catch (FitsException e) {
			throw new IOException("cannot read " + path, e);
		}
	}

	public static Header readHeader(String path) throws IOException {
		try (Fits fits = new Fits(new File(path))) {
			BasicHDU<?> hdu = fits.readHDU();
			if (hdu == null) {
				throw new IOException("no HDU in " + path);
			}
			return hdu.getHeader();
		} catch (FitsException e) {
			throw new IOException("cannot read " + path, e);
		}
	}

	/** new raster that carries over every non-structural keyword of the template */
	public static FitsImage derive(FitsImage template, int[] shape, float[] data) {
		return new FitsImage(null, template.header, shape, data);
	}

	public FitsImage withData(float[] newData) {
		return new FitsImage(null, header, shape, newData);
	}

	static int pixelCount(int[] shape) {
		int n = 1;
		for (int d : shape) {
			n *= d;
		}
		return n;
	}

	static void reverse(int[] a) {
		for (int i = 0, j = a.length - 1; i < j; i++, j--) {
			int t = a[i];
			a[i] = a[j];
			a[j] = t;
		}
	}

	public int naxis() {
		return shape.length;
	}

	// 1-based, as in the keywords
	public int axisLength(int axis) {
		return shape[axis - 1];
	}

	public int width() {
		return shape[0];
	}

	public int height() {
		return shape.length > 1 ? shape[1] : 1;
	}

	public int planeSize() {
		return width() * height();
	}

	/** index of the FREQ axis, or 0 if there is none */
	public int spectralAxis() {
		return spectralAxis(header, naxis());
	}

	public static int spectralAxis(Header h, int naxis) {
		for (int n = 1; n <= naxis; n++) {
			String ctype = h.getStringValue("CTYPE" + n);
			if (ctype != null && ctype.trim().toUpperCase().startsWith("FREQ")) {
				return n;
			}
		}
		return 0;
	}

	/** world coordinate of a 0-based pixel along a linear axis */
	public double world(int axis, double pixel) {
		double crval = header.getDoubleValue("CRVAL" + axis, 0.);
		double crpix = header.getDoubleValue("CRPIX" + axis, 1.);
		double cdelt = header.getDoubleValue("CDELT" + axis, 1.);
		return crval + (pixel + 1. - crpix) * cdelt;
	}

	/**
	 * pixel spacing along the first two axes, arcsec
	 * @throws IOException if either spacing is missing or zero
	 */
	public double[] pixelScale() throws IOException {
		double[] scale = {
				header.getDoubleValue("CDELT1", Double.NaN) * 3600.,
				header.getDoubleValue("CDELT2", Double.NaN) * 3600.};
		for (int i = 0; i < 2; i++) {
			if (!Double.isFinite(scale[i]) || scale[i] == 0) {
				throw new IOException(String.format("%s: no usable CDELT%d", path, i + 1));
			}
		}
		return scale;
	}

	public BeamShape beam() throws BeamMetadataError {
		return readBeam(header, path);
	}

	public static BeamShape readBeam(Header h, String path) throws BeamMetadataError {
		for (String key : new String[] {"BMAJ", "BMIN"}) {
			if (!h.containsKey(key)) {
				throw new BeamMetadataError(path, "missing " + key);
			}
		}
		double bmaj = h.getDoubleValue("BMAJ", Double.NaN);
		double bmin = h.getDoubleValue("BMIN", Double.NaN);
		double bpa = h.getDoubleValue("BPA", 0.);
		try {
			return BeamShape.fromDegrees(bmaj, bmin, bpa);
		} catch (IllegalArgumentException e) {
			throw new BeamMetadataError(path, e.getMessage());
		}
	}

	public static BeamShape readBeam(String path) throws BeamMetadataError {
		try {
			return readBeam(readHeader(path), path);
		} catch (IOException e) {
			throw new BeamMetadataError(path, e.getMessage());
		}
	}

	public void setBeam(BeamShape beam) {
		set("BMAJ", beam.majorDegrees(), "beam major axis [deg]");
		set("BMIN", beam.minorDegrees(), "beam minor axis [deg]");
		set("BPA", beam.pa, "beam position angle [deg]");
	}

	public void set(String key, double value, String comment) {
		updates.put(key, new Object[] {value, comment});
	}

	public void set(String key, String value, String comment) {
		updates.put(key, new Object[] {value, comment});
	}

	public void write(String dst) throws IOException {
		int[] javaAxes = shape.clone();
		reverse(javaAxes);
		Files.deleteIfExists(Paths.get(dst));
		try (Fits fits = new Fits()) {
			BasicHDU<?> hdu = Fits.makeHDU(ArrayFuncs.curl(data, javaAxes));
			Header out = hdu.getHeader();
			Cursor<String, HeaderCard> cards = header.iterator();
			while (cards.hasNext()) {
				HeaderCard card = cards.next();
				String key = card.getKey();
				if (!card.isKeyValuePair() || STRUCTURAL_KEYS.contains(key) || key.startsWith("NAXIS")) {
					continue;
				}
				out.updateLine(key, card);
			}
			for (Map.Entry<String, Object[]> e : updates.entrySet()) {
				Object value = e.getValue()[0];
				String comment = (String)e.getValue()[1];
				if (value instanceof Double) {
					out.addValue(e.getKey(), ((Double)value).doubleValue(), comment);
				} else {
					out.addValue(e.getKey(), (String)value, comment);
				}
			}
			fits.addHDU(hdu);
			try (BufferedFile bf = new BufferedFile(dst, "rw")) {
				fits.write(bf);
			}
		} catch (FitsException e) {
			throw new IOException("cannot write " + dst, e);
		}
		LOG.debug("wrote {}", dst);
	}

}
