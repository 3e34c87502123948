package com.mailspider.core.model;

import java.util.Objects;

/** 페이지에서 찾은 이메일 1건과 그 출처 URL */
public final class ExtractionResult {
    private final String email;
    private final String sourceUrl;

    public ExtractionResult(String email, String sourceUrl) {
        this.email = Objects.requireNonNull(email, "email");
        this.sourceUrl = Objects.requireNonNull(sourceUrl, "sourceUrl");
    }

    public String getEmail() { return email; }
    public String getSourceUrl() { return sourceUrl; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionResult that)) return false;
        return email.equals(that.email) && sourceUrl.equals(that.sourceUrl);
    }

    @Override
    public int hashCode() { return Objects.hash(email, sourceUrl); }

    @Override
    public String toString() { return email + " <- " + sourceUrl; }
}
