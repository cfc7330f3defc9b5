package com.thicket.db.parser;

import com.thicket.db.label.LabelResolver;
import com.thicket.db.model.ModelRecord;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.model.VariantRecord;
import com.thicket.db.sdk.LocalizedText;
import com.thicket.db.sdk.ParamOption;
import com.thicket.db.sdk.Plant;
import com.thicket.db.sdk.PlantParam;
import com.thicket.db.sdk.PlantSdk;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker-side conversion of one asset into a {@link ParsedModel}.
 *
 * Preview images are looked up next to the asset: {@code Acer.lbw.gz} uses
 * {@code Acer.lbw.png} or else {@code Acer.png}, and its variant {@code small} uses
 * {@code models/Acer_small.png} with the same stem. A missing image leaves the preview empty.
 */
@RequiredArgsConstructor
public class ModelRecordParser {
    private static final Logger log = LoggerFactory.getLogger(ModelRecordParser.class);

    private static final String PREVIEW_EXTENSION = ".png";
    private static final String VARIANT_PREVIEW_DIR = "models";

    private final PlantSdk sdk;

    public ParsedModel parse(Path assetFile) throws IOException {
        Plant plant = sdk.load(assetFile);
        return toParsedModel(plant, assetFile);
    }

    ParsedModel toParsedModel(Plant plant, Path assetFile) throws IOException {
        Path absolute = assetFile.toAbsolutePath().normalize();

        PlantParam variantParam = plant.findParam(Plant.VARIANT_PARAM)
                .orElseThrow(() -> new IOException("Asset has no variant parameter: " + assetFile));
        PlantParam seasonParam = plant.findParam(Plant.SEASON_PARAM)
                .orElseThrow(() -> new IOException("Asset has no season parameter: " + assetFile));
        ParamOption defaultVariant = variantParam.defaultOption()
                .orElseThrow(() -> new IOException("Variant default index out of range: " + assetFile));
        if (!plant.getVariants().contains(defaultVariant.getName())) {
            throw new IOException("Default variant \"" + defaultVariant.getName()
                    + "\" is not one of the asset's variants: " + assetFile);
        }
        ParamOption defaultSeason = seasonParam.defaultOption()
                .orElseThrow(() -> new IOException("Season default index out of range: " + assetFile));

        Map<String, Map<String, String>> labels = new LinkedHashMap<>();
        labels.put(plant.getName(), firstPerLocale(plant.getLabels()));

        List<String> seasons = new ArrayList<>();
        for (ParamOption season : seasonParam.getOptions()) {
            seasons.add(season.getName());
            labels.put(season.getName(), firstPerLocale(season.getLabels()));
        }

        Path dir = absolute.getParent();
        String previewStem = stripExtension(absolute.getFileName().toString());
        Path modelPreview = dir.resolve(previewStem + PREVIEW_EXTENSION);
        if (!Files.isRegularFile(modelPreview)) {
            previewStem = stripExtension(previewStem);
            modelPreview = dir.resolve(previewStem + PREVIEW_EXTENSION);
            if (!Files.isRegularFile(modelPreview)) {
                log.warn("Preview not found: {}", modelPreview);
                modelPreview = null;
            }
        }

        Map<String, VariantRecord> variants = new LinkedHashMap<>();
        int index = 0;
        for (String variant : plant.getVariants()) {
            Path variantPreview = dir.resolve(VARIANT_PREVIEW_DIR)
                    .resolve(previewStem + "_" + variant + PREVIEW_EXTENSION);
            if (!Files.isRegularFile(variantPreview)) {
                log.warn("Preview not found: {}", variantPreview);
                variantPreview = null;
            }

            variants.put(variant, VariantRecord.builder()
                    .index(index++)
                    .seasons(new ArrayList<>(seasons))
                    .defaultSeason(defaultSeason.getName())
                    .preview(pathOrEmpty(variantPreview))
                    .build());

            List<LocalizedText> variantLabels = variantParam.findOption(variant)
                    .map(ParamOption::getLabels)
                    .orElse(List.of());
            labels.put(variant, firstPerLocale(variantLabels));
        }

        ModelRecord model = ModelRecord.builder()
                .name(plant.getName())
                .filepath(absolute.toString())
                .md5(md5sum(absolute))
                .defaultVariant(defaultVariant.getName())
                .preview(pathOrEmpty(modelPreview))
                .variants(variants)
                .build();

        return new ParsedModel(model, labels);
    }

    /**
     * Keeps the first string the extractor reports for each locale.
     */
    static Map<String, String> firstPerLocale(List<LocalizedText> texts) {
        Map<String, String> byLocale = new LinkedHashMap<>();
        for (LocalizedText text : texts) {
            byLocale.putIfAbsent(LabelResolver.normalizeLocale(text.getLang()), text.getText());
        }
        return byLocale;
    }

    static String md5sum(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("MD5 digest unavailable", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String pathOrEmpty(Path path) {
        return path == null ? "" : path.toString();
    }
}
