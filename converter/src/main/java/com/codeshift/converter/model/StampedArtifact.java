package com.codeshift.converter.model;

import com.codeshift.converter.governance.GovernanceHeader;

/**
 * An extracted artifact with its governance header prepended.
 *
 * @param extracted   the code as it came out of the extractor
 * @param header      the provenance fields
 * @param headerBlock the header rendered in the target language's comment syntax
 * @param content     headerBlock followed by the code: the file that gets staged
 */
public record StampedArtifact(ExtractedArtifact extracted,
                              GovernanceHeader header,
                              String headerBlock,
                              String content) {}
