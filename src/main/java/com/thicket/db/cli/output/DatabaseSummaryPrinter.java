package com.thicket.db.cli.output;

import com.thicket.db.database.ModelDatabase;
import com.thicket.db.model.DatabaseInfo;
import com.thicket.db.view.ModelView;
import com.thicket.db.view.SeasonView;
import com.thicket.db.view.VariantView;

import java.io.PrintWriter;
import java.util.stream.Collectors;

/**
 * Prints the "read" summary: the info block followed by every model in name order.
 */
public class DatabaseSummaryPrinter {

    public void print(ModelDatabase db, PrintWriter out) {
        DatabaseInfo info = db.getInfo();
        out.printf("SDK Version: %s%n", info.getSdkVersion());
        out.printf("\tmajor: %d%n", info.getSdkMajor());
        out.printf("\tminor: %d%n", info.getSdkMinor());
        out.printf("\tmicro: %d%n", info.getSdkMicro());
        out.printf("Schema Version: %d%n", info.getSchemaVersion());
        out.printf("Loaded %d models:%n", db.modelCount());

        for (ModelView model : db) {
            out.printf("%s (%s)%n", model.getName(), model.getLabel());
            out.printf("\tfile: %s%n", model.getFilepath());
            out.printf("\tmd5: %s%n", model.getMd5());
            VariantView def = model.getVariant();
            if (def != null) {
                out.printf("\tdefault_variant: %s (%s)%n", def.getName(), def.getLabel());
            }
            out.println("\tvariants:");
            for (VariantView variant : model.getVariants()) {
                SeasonView season = variant.getSeason();
                out.printf("\t\t%s (%s) %s%n", variant.getName(),
                        season == null ? "" : season.getLabel(),
                        variant.getSeasons().stream().map(SeasonView::getName).collect(Collectors.toList()));
            }
        }
        out.flush();
    }
}
