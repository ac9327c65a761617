package com.example.filedrop.web;

import com.example.filedrop.service.FileGateway.FileSummary;
import java.util.List;

/**
 * HTTP payloads. Field names are written in snake_case by the {@code Gson}
 * instance in {@link ApiRoutes}.
 */
public final class Dto {

    private Dto() {
    }

    public static final class ErrorResponse {
        public String detail;
    }

    public static ErrorResponse fail(String detail) {
        ErrorResponse r = new ErrorResponse();
        r.detail = detail;
        return r;
    }

    public static final class InfoDto {
        public String name;
        public String lanIp;
        public int port;
        public String lanUrl;
        public boolean requiresCode;
        public String saveDir;
        public boolean isAdmin;
    }

    public static final class FilesResponse {
        public List<FileSummary> files;
    }

    public static final class UploadResponse {
        public String name;
        public long size;
    }

    public static final class SaveDirResponse {
        public String saveDir;
    }

    public static final class UpdateSettingsRequest {
        public String code;
        public String saveDir;
        public String accessCode;
    }
}
