package com.krickert.yappy.watch.file;

import java.nio.file.attribute.FileTime;

/**
 * The attributes a file is compared on between polls.
 */
public record FileSnapshot(long size, FileTime lastModified) {
}
