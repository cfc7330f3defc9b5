package com.thicket.db.parser;

import com.thicket.db.model.ModelRecord;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.model.VariantRecord;
import com.thicket.db.sdk.FakePlantSdk;
import com.thicket.db.sdk.LocalizedText;
import com.thicket.db.sdk.Plant;
import com.thicket.db.sdk.PlantParam;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ModelRecordParserTest {

    @TempDir
    Path tempDir;

    private final ModelRecordParser parser = new ModelRecordParser(new FakePlantSdk());

    private Path plantDir;
    private Path asset;

    @BeforeEach
    void setUp() throws IOException {
        plantDir = Files.createDirectories(tempDir.resolve("Acer"));
        asset = Files.writeString(plantDir.resolve("Acer.lbw.gz"), "plant");
    }

    @Test
    void testParseBuildsModelRecord() throws IOException {
        ParsedModel parsed = parser.parse(asset);
        ModelRecord model = parsed.getModel();

        assertThat(model.getName()).isEqualTo("Acer");
        assertThat(model.getFilepath()).isEqualTo(asset.toAbsolutePath().normalize().toString());
        // md5("plant")
        assertThat(model.getMd5()).isEqualTo("9ea0a36b3a20901fafe834eb519a595c");
        assertThat(model.getDefaultVariant()).isEqualTo("large");
        assertThat(model.getVariants()).containsOnlyKeys("small", "large");

        VariantRecord small = model.getVariants().get("small");
        assertThat(small.getIndex()).isZero();
        assertThat(small.getSeasons()).containsExactly("spring", "summer");
        assertThat(small.getDefaultSeason()).isEqualTo("summer");
        assertThat(model.getVariants().get("large").getIndex()).isEqualTo(1);
    }

    @Test
    void testLabelsKeepFirstStringPerLocale() throws IOException {
        ParsedModel parsed = parser.parse(asset);

        assertThat(parsed.getLabels().get("Acer"))
                .containsEntry("en", "Acer Tree")
                .containsEntry("de-DE", "Acer Baum")
                .hasSize(2);
        assertThat(parsed.getLabels().get("large")).containsEntry("de", "Groß");
        assertThat(parsed.getLabels().get("summer")).containsEntry("de", "Sommer");
        assertThat(parsed.getLabels()).containsKeys("small", "spring");
    }

    @Test
    void testMissingPreviewsAreEmpty() throws IOException {
        ModelRecord model = parser.parse(asset).getModel();

        assertThat(model.getPreview()).isEmpty();
        assertThat(model.getVariants().get("small").getPreview()).isEmpty();
    }

    @Test
    void testPreviewWithFullStem() throws IOException {
        Path preview = Files.writeString(plantDir.resolve("Acer.lbw.png"), "png");
        Files.createDirectories(plantDir.resolve("models"));
        Path variantPreview = Files.writeString(plantDir.resolve("models/Acer.lbw_small.png"), "png");

        ModelRecord model = parser.parse(asset).getModel();

        assertThat(model.getPreview()).isEqualTo(preview.toAbsolutePath().normalize().toString());
        assertThat(model.getVariants().get("small").getPreview())
                .isEqualTo(variantPreview.toAbsolutePath().normalize().toString());
        assertThat(model.getVariants().get("large").getPreview()).isEmpty();
    }

    @Test
    void testPreviewWithShortStem() throws IOException {
        Path preview = Files.writeString(plantDir.resolve("Acer.png"), "png");
        Files.createDirectories(plantDir.resolve("models"));
        Path variantPreview = Files.writeString(plantDir.resolve("models/Acer_large.png"), "png");

        ModelRecord model = parser.parse(asset).getModel();

        assertThat(model.getPreview()).isEqualTo(preview.toAbsolutePath().normalize().toString());
        assertThat(model.getVariants().get("large").getPreview())
                .isEqualTo(variantPreview.toAbsolutePath().normalize().toString());
    }

    @Test
    void testUnreadableAssetFails() throws IOException {
        Files.writeString(asset, "broken");

        assertThatThrownBy(() -> parser.parse(asset)).isInstanceOf(IOException.class);
    }

    @Test
    void testMissingSeasonParameterFails() {
        Plant plant = Plant.builder()
                .name("Acer")
                .param(PlantParam.builder().name(Plant.VARIANT_PARAM).defaultIndex(0).build())
                .build();

        assertThatThrownBy(() -> parser.toParsedModel(plant, asset))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no season parameter");
    }

    @Test
    void testDefaultVariantMustBeDeclared() {
        Plant sample = FakePlantSdk.samplePlant("Acer");
        Plant plant = Plant.builder()
                .name("Acer")
                .params(sample.getParams())
                .variant("small")
                .build();

        assertThatThrownBy(() -> parser.toParsedModel(plant, asset))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Default variant \"large\"");
    }

    @Test
    void testFirstPerLocaleNormalizesTags() {
        assertThat(ModelRecordParser.firstPerLocale(List.of(
                new LocalizedText("pt_BR", "Bordo"),
                new LocalizedText("pt-BR", "Ácer"))))
                .containsExactly(entry("pt-BR", "Bordo"));
    }
}
