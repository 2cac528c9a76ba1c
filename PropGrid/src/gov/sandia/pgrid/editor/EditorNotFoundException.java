/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

@SuppressWarnings("serial")
public class EditorNotFoundException extends RuntimeException
{
    protected String name;

    public EditorNotFoundException (String name)
    {
        super ("No editor registered under the name \"" + name + "\"");
        this.name = name;
    }

    public String getName ()
    {
        return name;
    }
}
