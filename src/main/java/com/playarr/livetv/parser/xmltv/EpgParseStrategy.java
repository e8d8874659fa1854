package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.model.Program;

import java.nio.file.Path;
import java.util.List;

/**
 * One way of turning an XMLTV file into validated programme records without an owner.
 */
public interface EpgParseStrategy {

    /**
     * @throws com.playarr.livetv.exception.EpgParseException if the document cannot be read
     * @throws com.playarr.livetv.exception.SyncCancelledException if the thread is interrupted
     */
    List<Program> parse(Path xmlFile);

    String name();
}
