package org.ogletest.lang;

import org.ogletest.validation.Inputs;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public
final
class PatternHelper
{
    private static Inputs inputs = new Inputs();

    private PatternHelper() {}

    // Rethrows syntax errors as IllegalArgumentException carrying a single line
    // message, since patterns here usually come from command lines or system
    // properties.
    public 
    static 
    Pattern 
    compile( CharSequence pat ) 
    { 
        inputs.notNull( pat, "pat" );

        try { return Pattern.compile( pat.toString() ); }
        catch ( PatternSyntaxException pse ) 
        {
            throw new IllegalArgumentException(
                "Invalid pattern '" + pat + "': " + 
                getSingleLineMessage( pse ), pse );
        }
    }

    public
    static
    CharSequence
    getSingleLineMessage( PatternSyntaxException pse )
    {
        inputs.notNull( pse, "pse" );

        StringBuilder msg = new StringBuilder();
        msg.append( pse.getDescription() );

        int indx = pse.getIndex();

        if ( indx >= 0 )
        {
            msg.append( " (near index " ).append( indx ).append( ")" );
        }

        return msg;
    }
}
