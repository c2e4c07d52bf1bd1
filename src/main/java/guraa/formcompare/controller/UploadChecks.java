package guraa.formcompare.controller;

import org.springframework.web.multipart.MultipartFile;

final class UploadChecks {

    private UploadChecks() {
    }

    /**
     * Accept uploads declared as PDF, or undeclared uploads named *.pdf. The decoder
     * still checks the header.
     */
    static boolean isPdf(MultipartFile file) {
        String contentType = file.getContentType();
        if ("application/pdf".equalsIgnoreCase(contentType)) {
            return true;
        }
        String name = file.getOriginalFilename();
        boolean undeclared = contentType == null || "application/octet-stream".equalsIgnoreCase(contentType);
        return undeclared && name != null && name.toLowerCase().endsWith(".pdf");
    }
}
