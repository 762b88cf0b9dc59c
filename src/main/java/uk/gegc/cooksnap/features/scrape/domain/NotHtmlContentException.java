package uk.gegc.cooksnap.features.scrape.domain;

public class NotHtmlContentException extends LinkFetchException {

    private final String contentType;

    public NotHtmlContentException(String contentType) {
        super(FetchOutcome.NOT_HTML, "Non-HTML content type: " + contentType, null);
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
