package org.example.stackanalysis.variant;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Output of the colocalisation analyser run with {@code log_results}: a column header
 * line, then one row per frame prefixed with the exported file name.
 *
 * <pre>
 * Stack colocalisation (Otsu) : 1851.ome.tif
 * Image,p,Method,Frame,Ch1,Ch2,Ch3,n,Area,M1,Sig,M2,Sig,R,Sig
 * 1851.ome.tif,0.0500,Otsu,1,c1,c2,None,6528,9.96%,0.9460,true,0.9334,true,0.2940,false
 * </pre>
 */
public class ResultsTableGrammar implements CaptureGrammar {

    private static final Pattern HEADER = Pattern.compile("Image,(p,Method.*)");
    private static final Pattern ROW = Pattern.compile("(\\d{1,18})\\.ome\\.tif,(.*)");

    @Override
    public BlockOpening matchOpening(String line) {
        Matcher m = HEADER.matcher(line);
        return m.matches() ? new BlockOpening(null, m.group(1)) : null;
    }

    @Override
    public BlockRow matchRow(String line) {
        Matcher m = ROW.matcher(line);
        return m.matches() ? new BlockRow(Long.valueOf(m.group(1)), m.group(2)) : null;
    }
}
