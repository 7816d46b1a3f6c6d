package com.delta.creatorscout.discovery.service;

import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.Platform;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

@Component
public class CreatorCsvExporter {
    static final String[] HEADERS = {
        "Username",
        "Display Name",
        "Platform",
        "Followers",
        "Verified",
        "Private",
        "Business",
        "Bio",
        "Email",
        "Profile URL",
        "Source URL",
        "Quality Score",
        "Engagement Rate",
        "Enrichment"
    };

    public void write(DiscoveryJob job, List<CreatorRecord> records, Writer writer) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .build();
        try {
            CSVPrinter printer = new CSVPrinter(writer, format);
            for (CreatorRecord record : records) {
                printer.printRecord(
                    nullToEmpty(record.handle()),
                    nullToEmpty(record.displayName()),
                    job.platform().name(),
                    record.followerCount(),
                    record.verified(),
                    record.privateAccount(),
                    record.businessAccount(),
                    nullToEmpty(record.biography()),
                    String.join("; ", record.emails()),
                    profileUrl(job.platform(), record.handle()),
                    record.source() == null ? "" : nullToEmpty(record.source().url()),
                    String.format(Locale.ROOT, "%.2f", record.qualityScore()),
                    String.format(Locale.ROOT, "%.2f", record.engagementRate()),
                    record.enrichmentStatus().name()
                );
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export for job " + job.id(), e);
        }
    }

    static String profileUrl(Platform platform, String handle) {
        if (handle == null || handle.isBlank()) {
            return "";
        }
        String clean = handle.trim().startsWith("@") ? handle.trim().substring(1) : handle.trim();
        return switch (platform) {
            case TIKTOK -> "https://www.tiktok.com/@" + clean;
            case INSTAGRAM -> "https://www.instagram.com/" + clean;
            case YOUTUBE -> "https://www.youtube.com/@" + clean;
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
