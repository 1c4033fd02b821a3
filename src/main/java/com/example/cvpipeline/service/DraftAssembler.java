package com.example.cvpipeline.service;

import com.example.cvpipeline.agent.HeaderComposer;
import com.example.cvpipeline.model.CvDraft;
import com.example.cvpipeline.model.HeaderSection;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.model.RoleBulletSet;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.StitchedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits bullet sets and a header into one rendered draft.
 * <p>
 * The stitcher reserves exactly the words the header renders to, then the header is re-checked
 * against the bullets that made it in. If the check removes anything the document is stitched
 * again with the smaller reserve.
 */
@Service
public class DraftAssembler {

    private static final Logger log = LoggerFactory.getLogger(DraftAssembler.class);

    private static final int MAX_FIT_PASSES = 3;

    private final Stitcher stitcher;
    private final HeaderComposer headerComposer;
    private final PlainTextCvRenderer renderer;

    public DraftAssembler(Stitcher stitcher, HeaderComposer headerComposer, PlainTextCvRenderer renderer) {
        this.stitcher = stitcher;
        this.headerComposer = headerComposer;
        this.renderer = renderer;
    }

    /** Stitches the sets leaving a fixed number of words for a header that does not exist yet. */
    public StitchedDocument stitch(List<RoleBulletSet> sets, JobContext context, int reservedWords) {
        return stitcher.stitch(sets, context, reservedWords);
    }

    /** Stitches the sets leaving room for the given header. */
    public StitchedDocument stitchFor(List<RoleBulletSet> sets, JobContext context, HeaderSection header) {
        return stitcher.stitch(sets, context, renderer.reservedWords(header));
    }

    public CvDraft assemble(List<RoleBulletSet> sets, List<RoleRecord> roles, JobContext context,
                            HeaderSection header) {
        HeaderSection current = header;
        StitchedDocument document = stitchFor(sets, context, current);

        for (int pass = 1; pass <= MAX_FIT_PASSES; pass++) {
            HeaderSection checked = ensureSummary(headerComposer.revalidate(current, document, roles),
                    document, roles, context);
            boolean unchanged = sameContent(checked, current);
            current = checked;
            if (unchanged) break;
            log.debug("Header changed after fit pass {}, restitching", pass);
            document = stitchFor(sets, context, current);
        }
        current = ensureSummary(headerComposer.revalidate(current, document, roles), document, roles, context);
        return renderer.draft(document, current);
    }

    private HeaderSection ensureSummary(HeaderSection header, StitchedDocument document, List<RoleRecord> roles,
                                        JobContext context) {
        if (!header.summary().isEmpty()) {
            return header;
        }
        log.warn("No grounded summary sentence left, switching to fallback summary");
        HeaderSection fallback = headerComposer.composeFallback(document, roles, context);
        List<String> rejected = new ArrayList<>(header.rejectedClaims());
        rejected.addAll(fallback.rejectedClaims());
        return new HeaderSection(fallback.summary(), header.skills().isEmpty() ? fallback.skills() : header.skills(),
                rejected, true);
    }

    private static boolean sameContent(HeaderSection a, HeaderSection b) {
        return a.summary().equals(b.summary()) && a.skillNames().equals(b.skillNames());
    }
}
