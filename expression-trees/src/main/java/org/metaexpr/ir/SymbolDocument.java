package org.metaexpr.ir;

import javax.annotation.Nullable;
import java.util.Objects;

/** Source file information referenced by debug-info nodes. */
public final class SymbolDocument {
    public final String fileName;
    @Nullable
    public final String language;
    @Nullable
    public final String languageVendor;
    @Nullable
    public final String documentType;

    public SymbolDocument(String fileName, @Nullable String language,
                          @Nullable String languageVendor, @Nullable String documentType) {
        this.fileName = fileName;
        this.language = language;
        this.languageVendor = languageVendor;
        this.documentType = documentType;
    }

    public SymbolDocument(String fileName) {
        this(fileName, null, null, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SymbolDocument that = (SymbolDocument) o;
        return this.fileName.equals(that.fileName) &&
                Objects.equals(this.language, that.language) &&
                Objects.equals(this.languageVendor, that.languageVendor) &&
                Objects.equals(this.documentType, that.documentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.fileName, this.language, this.languageVendor, this.documentType);
    }

    @Override
    public String toString() {
        return this.fileName;
    }
}
