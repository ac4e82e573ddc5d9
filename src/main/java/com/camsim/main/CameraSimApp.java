package com.camsim.main;

import com.camsim.model.AppConfig;
import com.camsim.model.BracketFrame;
import com.camsim.model.FrameMetadata;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import com.camsim.service.Camera;
import com.camsim.service.FitsImageService;
import com.camsim.service.ProcessingPipeline;
import com.camsim.service.RadiometricSensorModel;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class CameraSimApp {

    private static final Logger LOG = Logger.getLogger(CameraSimApp.class.getName());

    private final FitsImageService fitsService = new FitsImageService();

    public static void main(String[] args) {
        configureLogging();
        if (args.length < 2) {
            System.err.println("Uso: CameraSimApp <escena.fits> <directorio-salida>");
            System.exit(2);
        }
        try {
            List<File> written = new CameraSimApp().run(new File(args[0]), new File(args[1]));
            LOG.info(written.size() + " fotogramas simulados");
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Simulacion fallida: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    public List<File> run(File sceneFile, File outDir) throws Exception {
        ImageData scene = fitsService.readScene(sceneFile);
        Camera camera = buildCamera(scene);

        if (!outDir.isDirectory() && !outDir.mkdirs())
            throw new IOException("No se pudo crear el directorio " + outDir);

        String mode = AppConfig.getAutoExposureMode();
        List<BracketFrame> frames = camera.simulateBracket(scene, AppConfig.getBracketStops(), mode);

        String base = sceneFile.getName().replaceFirst("\\.[^.]+$", "");
        RadiometricSensorModel sensor = camera.getSensor();
        List<File> written = new ArrayList<>();
        for (BracketFrame frame : frames) {
            File out = new File(outDir, String.format(Locale.ROOT, "%s_%+.1fEV.fits", base, frame.stop));
            fitsService.writeFrame(frame.image, new FrameMetadata(frame.exposureTime, sensor.getGain(), sensor.getOffset()), out);
            written.add(out);
        }
        return written;
    }

    Camera buildCamera(ImageData scene) {
        long seed = AppConfig.getRandomSeed();
        Camera camera = (seed < 0)
                ? new Camera(scene.getHeight(), scene.getWidth())
                : new Camera(scene.getHeight(), scene.getWidth(), seed);

        PixelType outType = PixelType.forBits(AppConfig.getOutputBits());
        if (outType != PixelType.UINT8) {
            RadiometricSensorModel sensor = camera.getSensor();
            camera.setPipeline(ProcessingPipeline.standard(sensor.getBayerPhase(), sensor.getMaxDN(), outType));
        }
        return camera;
    }

    private static void configureLogging() {
        try (InputStream in = CameraSimApp.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("No se pudo leer logging.properties: " + e.getMessage());
        }
    }
}
