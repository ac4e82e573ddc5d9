package com.camsim.service;

import com.camsim.model.FrameMetadata;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Lectura de escenas y escritura de fotogramas simulados en FITS. Las imagenes de color
 * se guardan como cubo [canal][fila][columna].
 */
public class FitsImageService {

    private static final Logger LOG = Logger.getLogger(FitsImageService.class.getName());

    public ImageData readScene(File f) throws IOException, FitsException {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsException("Sin HDU primario en " + f);
            Header header = hdu.getHeader();
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            double bzero = header.getDoubleValue("BZERO", 0.0);

            double[][][] cube = toCube(hdu.getKernel());
            int planes = cube.length;
            if (planes != 1 && planes != 3)
                throw new FitsException("La escena debe tener 1 o 3 planos, tiene " + planes);
            int h = cube[0].length;
            int w = cube[0][0].length;

            // Un plano se replica en los tres canales
            ImageData scene = new ImageData(h, w, 3, PixelType.DOUBLE);
            for (int c = 0; c < 3; c++) {
                double[][] plane = cube[planes == 1 ? 0 : c];
                for (int y = 0; y < h; y++)
                    for (int x = 0; x < w; x++)
                        scene.set(y, x, c, plane[y][x] * bscale + bzero);
            }
            LOG.info("Escena cargada: " + f.getName() + " " + scene);
            return scene;
        }
    }

    public void writeFrame(ImageData image, FrameMetadata meta, File f) throws IOException, FitsException {
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(toKernel(image));
            Header header = hdu.getHeader();
            header.addValue("EXPTIME", meta.exposureTime, "exposure time [s]");
            header.addValue("GAIN", meta.gain, "sensor gain [DN/e-]");
            header.addValue("OFFSET", meta.offset, "black level [DN]");
            fits.addHDU(hdu);
            fits.write(f);
        }
        LOG.info("Fotograma escrito: " + f.getAbsolutePath());
    }

    public FrameMetadata readMetadata(File f) throws IOException, FitsException {
        FrameMetadata meta = new FrameMetadata();
        try (Fits fits = new Fits(f)) {
            Header header = fits.getHDU(0).getHeader();

            meta.exposureTime = header.getDoubleValue("EXPTIME", 0);
            if (meta.exposureTime == 0) meta.exposureTime = header.getDoubleValue("EXPOSURE", 0);
            meta.gain = header.getDoubleValue("GAIN", 0);
            meta.offset = header.getDoubleValue("OFFSET", 0);
        }
        return meta;
    }

    // UINT8 -> BITPIX 8, UINT16 -> 32 (sin BZERO), DOUBLE -> -64
    private Object toKernel(ImageData img) {
        int h = img.getHeight(), w = img.getWidth(), nc = img.getChannels();
        switch (img.getType()) {
            case UINT8: {
                byte[][][] k = new byte[nc][h][w];
                for (int c = 0; c < nc; c++) for (int y = 0; y < h; y++) for (int x = 0; x < w; x++)
                    k[c][y][x] = (byte) (int) img.get(y, x, c);
                return nc == 1 ? k[0] : k;
            }
            case UINT16: {
                int[][][] k = new int[nc][h][w];
                for (int c = 0; c < nc; c++) for (int y = 0; y < h; y++) for (int x = 0; x < w; x++)
                    k[c][y][x] = (int) img.get(y, x, c);
                return nc == 1 ? k[0] : k;
            }
            default: {
                double[][][] k = new double[nc][h][w];
                for (int c = 0; c < nc; c++) for (int y = 0; y < h; y++) for (int x = 0; x < w; x++)
                    k[c][y][x] = img.get(y, x, c);
                return nc == 1 ? k[0] : k;
            }
        }
    }

    private double[][][] toCube(Object k) throws FitsException {
        if (k instanceof Object[] && ((Object[]) k).length > 0 && ((Object[]) k)[0] instanceof Object[]) {
            Object[] planes = (Object[]) k;
            double[][][] cube = new double[planes.length][][];
            for (int i = 0; i < planes.length; i++) cube[i] = toDouble(planes[i]);
            return cube;
        }
        return new double[][][] { toDouble(k) };
    }

    private double[][] toDouble(Object k) throws FitsException {
        if (k instanceof byte[][]) { byte[][] s = (byte[][]) k; double[][] d = new double[s.length][s[0].length]; for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j] & 0xFF; return d; }
        if (k instanceof short[][]) { short[][] s = (short[][]) k; double[][] d = new double[s.length][s[0].length]; for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j]; return d; }
        if (k instanceof int[][]) { int[][] s = (int[][]) k; double[][] d = new double[s.length][s[0].length]; for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j]; return d; }
        if (k instanceof float[][]) { float[][] f = (float[][]) k; double[][] d = new double[f.length][f[0].length]; for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j]; return d; }
        if (k instanceof double[][]) { double[][] s = (double[][]) k; double[][] d = new double[s.length][]; for (int i = 0; i < s.length; i++) d[i] = s[i].clone(); return d; }
        throw new FitsException("Tipo de datos FITS no soportado: " + (k == null ? "null" : k.getClass().getSimpleName()));
    }
}
