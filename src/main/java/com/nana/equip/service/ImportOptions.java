package com.nana.equip.service;

import com.nana.equip.domain.ImportMode;

/**
 * Per-call settings for {@link EquipmentImportService#importFile}.
 * Defaults: {@link ImportMode#REPLACE}, no user, links restored, file name
 * taken from the path.
 */
public final class ImportOptions {

    private final ImportMode mode;
    private final String     userId;
    private final boolean    skipRelink;
    private final String     filename;

    private ImportOptions(Builder builder) {
        this.mode       = builder.mode == null ? ImportMode.REPLACE : builder.mode;
        this.userId     = builder.userId;
        this.skipRelink = builder.skipRelink;
        this.filename   = builder.filename;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImportMode getMode()    { return mode; }
    public String getUserId()      { return userId; }
    public boolean isSkipRelink()  { return skipRelink; }

    /** @return display file name recorded on the batch, or null to use the path's */
    public String getFilename()    { return filename; }

    @Override
    public String toString() {
        return "ImportOptions{mode=" + mode + ", user=" + userId
               + ", skipRelink=" + skipRelink + '}';
    }

    public static final class Builder {

        private ImportMode mode = ImportMode.REPLACE;
        private String     userId;
        private boolean    skipRelink;
        private String     filename;

        private Builder() {
        }

        public Builder mode(ImportMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder skipRelink(boolean skipRelink) {
            this.skipRelink = skipRelink;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }
}
