package com.xksgroup.hlstranscoder.service.helper;

/**
 * Object key layout. Everything a video produces lives under its own id.
 */
public final class StorageKeys {

    public static final String PLAYLIST_NAME = "index.m3u8";

    private StorageKeys() {
    }

    public static String source(String videoId, String extension) {
        String ext = extension == null || extension.isBlank() ? "mp4" : extension.toLowerCase();
        return "source/" + videoId + "." + ext;
    }

    public static String renditionPrefix(String videoId, int height) {
        return "HLS/" + videoId + "/" + height + "/";
    }

    public static String renditionPlaylist(String videoId, int height) {
        return renditionPrefix(videoId, height) + PLAYLIST_NAME;
    }

    public static String renditionObject(String videoId, int height, String fileName) {
        return renditionPrefix(videoId, height) + fileName;
    }

    public static String masterPlaylist(String videoId) {
        return "HLS/" + videoId + "/" + PLAYLIST_NAME;
    }

    /**
     * Reference to a rendition playlist relative to the master playlist.
     */
    public static String relativeVariantUri(int height) {
        return height + "/" + PLAYLIST_NAME;
    }

    /**
     * Extension of an uploaded file name without the dot, {@code mp4} when absent.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "mp4";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "mp4";
        }
        String ext = name.substring(dot + 1).toLowerCase();
        return ext.matches("[a-z0-9]{1,8}") ? ext : "mp4";
    }
}
